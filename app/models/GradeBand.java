package models;

import com.fasterxml.jackson.databind.node.ObjectNode;
import play.libs.Json;

import java.util.Objects;

/**
 * Reader age range and grade level for an ARI score, e.g. {@code ("9-10", "Forth Grade")}.
 */
public final class GradeBand {
    private final String age;
    private final String gradeLevel;

    public GradeBand(String age, String gradeLevel) {
        this.age = age;
        this.gradeLevel = gradeLevel;
    }

    public String getAge() {
        return age;
    }

    public String getGradeLevel() {
        return gradeLevel;
    }

    public ObjectNode toJson() {
        ObjectNode node = Json.newObject();
        node.put("age", age);
        node.put("gradeLevel", gradeLevel);
        return node;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GradeBand)) return false;
        GradeBand that = (GradeBand) o;
        return age.equals(that.age) && gradeLevel.equals(that.gradeLevel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(age, gradeLevel);
    }

    @Override
    public String toString() {
        return "GradeBand{age='" + age + "', gradeLevel='" + gradeLevel + "'}";
    }
}
