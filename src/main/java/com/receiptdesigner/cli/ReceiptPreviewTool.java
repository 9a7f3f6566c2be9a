package com.receiptdesigner.cli;

import com.receiptdesigner.core.command.CommandListFormatter;
import com.receiptdesigner.core.command.PrinterCommand;
import com.receiptdesigner.core.json.DesignDocumentReader;
import com.receiptdesigner.core.json.OrderJsonReader;
import com.receiptdesigner.core.model.DesignDocument;
import com.receiptdesigner.core.order.Order;
import com.receiptdesigner.core.render.ReceiptInterpreter;
import com.receiptdesigner.core.template.DesignTemplates;
import com.receiptdesigner.logging.AppLogger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line preview: renders a design (file or built-in template) against an optional order
 * and prints the resulting printer commands.
 *
 * <pre>
 * ReceiptPreviewTool &lt;design.json | --template NAME&gt; [order.json] [--json]
 * </pre>
 */
public final class ReceiptPreviewTool {
    private static final Logger LOGGER = AppLogger.get();

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
        "Usage: ReceiptPreviewTool <design.json | --template basic|detailed> [order.json] [--json]";

    private ReceiptPreviewTool() {}

    public static void main(String[] args) {
        int code = run(args, System.out);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out) {
        boolean json = false;
        String templateName = null;
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--json".equals(arg)) {
                json = true;
            } else if ("--template".equals(arg)) {
                if (i + 1 >= args.length) {
                    return usage("--template needs a name");
                }
                templateName = args[++i];
            } else if (arg.startsWith("--")) {
                return usage("Unknown option " + arg);
            } else {
                positional.add(arg);
            }
        }

        int expectedFiles = templateName == null ? 2 : 1;
        if ((templateName == null && positional.isEmpty()) || positional.size() > expectedFiles) {
            return usage(null);
        }

        DesignDocument design;
        Path orderPath;
        try {
            if (templateName != null) {
                Optional<DesignDocument> builtIn = DesignTemplates.byName(templateName);
                if (builtIn.isEmpty()) {
                    return usage("Unknown template '" + templateName + "'");
                }
                design = builtIn.get();
                orderPath = positional.isEmpty() ? null : Path.of(positional.get(0));
            } else {
                design = DesignDocumentReader.read(readJson(Path.of(positional.get(0))));
                orderPath = positional.size() > 1 ? Path.of(positional.get(1)) : null;
            }
            Order order = orderPath == null ? null : OrderJsonReader.read(readJson(orderPath));

            List<PrinterCommand> commands = new ReceiptInterpreter().render(design, order);
            if (json) {
                out.println(CommandListFormatter.toJson(commands).toString(2));
            } else {
                out.print(CommandListFormatter.toText(commands));
            }
            out.flush();
            return EXIT_OK;
        } catch (IOException | JSONException ex) {
            LOGGER.log(Level.SEVERE, "Failed to load preview input: " + ex.getMessage(), ex);
            return EXIT_FAILURE;
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Invalid preview input: " + ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private static JSONObject readJson(Path path) throws IOException {
        return new JSONObject(Files.readString(path, StandardCharsets.UTF_8));
    }

    private static int usage(String problem) {
        if (problem != null) {
            System.err.println(problem);
        }
        System.err.println(USAGE);
        return EXIT_USAGE;
    }
}
