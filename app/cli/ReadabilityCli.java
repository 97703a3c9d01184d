package cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import models.ReadabilityReport;
import models.ServiceResult;
import services.ReadabilityService;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Prints text statistics and readability scores.
 *
 * <pre>
 * ReadabilityCli [--it] [text ...]
 * </pre>
 * With no text arguments the text is read from standard input. {@code --it}
 * prints only the Gulpease index.
 */
public final class ReadabilityCli {

    private final ReadabilityService service;
    private final PrintStream out;
    private final PrintStream err;

    ReadabilityCli(ReadabilityService service, PrintStream out, PrintStream err) {
        this.service = service;
        this.out = out;
        this.err = err;
    }

    /**
     * Builds the CLI from the same {@code readability.*} settings the server reads.
     */
    static ReadabilityCli fromConfig(Config config, PrintStream out, PrintStream err) {
        return new ReadabilityCli(new ReadabilityService(config), out, err);
    }

    public static void main(String[] args) throws IOException {
        ReadabilityCli cli = fromConfig(ConfigFactory.load(), System.out, System.err);
        System.exit(cli.run(args, System.in));
    }

    int run(String[] args, InputStream stdin) throws IOException {
        boolean italian = args.length > 0 && args[0].equals("--it");
        String[] words = italian ? Arrays.copyOfRange(args, 1, args.length) : args;

        // Combine all args in case the text has spaces
        String text = words.length > 0
                ? String.join(" ", words)
                : readAll(stdin);
        if (text.isEmpty()) {
            err.println("Please provide text as arguments or on standard input.");
            return 1;
        }

        if (italian) {
            service.buildStats(text).print(out);
            printScore("Gulpease", service.calculateGulpease(text));
            return 0;
        }

        ReadabilityReport report = service.analyze(text);
        report.getStats().print(out);
        printScore("Coleman-Liau", report.getColemanLiau());
        printScore("ARI", report.getAri());
        report.getAriGrade().ifPresent(g ->
                out.println("ARI grade:\t" + g.getGradeLevel() + " (age " + g.getAge() + ")"));
        printScore("Gulpease", report.getGulpease());
        printScore("Reading ease", report.getReadingEase());
        printScore("Grade level", report.getGradeLevel());
        return 0;
    }

    private void printScore(String label, ServiceResult<?> score) {
        String value = score.getData()
                .map(Object::toString)
                .orElseGet(() -> score.getError().map(e -> e.getMessage()).orElse("n/a"));
        out.println(label + ":\t" + value);
    }

    private static String readAll(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        in.transferTo(buf);
        return buf.toString(StandardCharsets.UTF_8);
    }
}
