package models;

import play.libs.Json;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Represents a failed readability computation.
 */
public class ErrorInfo {
    private final ReadabilityError code;
    private final String message;

    public ErrorInfo(ReadabilityError code, String message) {
        this.code = code;
        this.message = message;
    }

    public static ErrorInfo of(ReadabilityError code, String formula) {
        return new ErrorInfo(code, code.getMessage() + " Cannot calculate " + formula + ".");
    }

    public ReadabilityError getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public ObjectNode toJson() {
        ObjectNode node = Json.newObject();
        node.put("status", "error");
        node.put("code", code.name());
        node.put("message", message);
        return node;
    }
}
