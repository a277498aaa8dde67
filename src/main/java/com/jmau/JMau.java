package com.jmau;

import com.jmau.filter.FilterModule;
import com.jmau.filter.FilterRegistry;
import com.jmau.json.JsonValueParser;
import com.jmau.output.ValueFormatter;
import com.jmau.render.Context;
import com.jmau.render.RenderOptions;
import com.jmau.value.Value;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "jmau", mixinStandardHelpOptions = true, version = "1.0",
         description = "Render Mau templates against a JSON context")
public class JMau implements Callable<Integer> {
    @Parameters(index = "0", arity = "0..1", description = "The template to render (a path with --template-file)")
    private String template;

    @Parameters(index = "1", arity = "0..1", description = "JSON context file (default: stdin)")
    private File contextFile;

    @Option(names = {"-f", "--template-file"}, description = "Read the template from the given file")
    private boolean templateFile = false;

    @Option(names = {"-p", "--preserve-types"}, description = "Print a single-expression result as JSON")
    private boolean preserveTypes = false;

    @Option(names = {"-m", "--map"}, description = "Treat the template as a JSON map template with directives")
    private boolean mapTemplate = false;

    @Option(names = {"-c", "--compact-output"}, description = "Compact JSON output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-S", "--sort-keys"}, description = "Sort object keys in JSON output")
    private boolean sortKeys = false;

    @Option(names = {"-l", "--list-filters"}, description = "List the built-in filters and exit")
    private boolean listFilters = false;

    private final InputStream stdin;
    private final PrintStream stdout;
    private final PrintStream stderr;

    public JMau() {
        this(System.in, System.out, System.err);
    }

    JMau(InputStream stdin, PrintStream stdout, PrintStream stderr) {
        this.stdin = stdin;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JMau()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (listFilters) {
            for (FilterModule.FilterSpec filter : FilterRegistry.builtIn().filters()) {
                stdout.printf("%-16s %s%n", filter.name(), filter.description());
            }
            return 0;
        }
        if (template == null) {
            stderr.println("Error: Missing template");
            return 1;
        }
        try {
            String source = templateFile
                    ? Files.readString(new File(template).toPath(), StandardCharsets.UTF_8)
                    : template;
            Context context = readContext();
            Mau mau = Mau.create();
            ValueFormatter formatter = new ValueFormatter(!compactOutput, sortKeys);

            if (mapTemplate) {
                Value mapSource = new JsonValueParser().parse(source);
                stdout.println(formatter.format(mau.renderMap(mapSource, context, RenderOptions.preservingTypes())));
            } else if (preserveTypes) {
                stdout.println(formatter.format(mau.render(source, context, RenderOptions.preservingTypes())));
            } else {
                stdout.print(ValueFormatter.stringify(mau.render(source, context, RenderOptions.defaults())));
                stdout.flush();
            }

            return 0;
        } catch (IOException | TemplateException e) {
            stderr.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private Context readContext() throws IOException {
        JsonValueParser parser = new JsonValueParser();
        Value context;
        if (contextFile != null) {
            try (InputStream input = new FileInputStream(contextFile)) {
                context = parser.parse(input);
            }
        } else {
            String input = new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
            if (input.isBlank()) {
                return Context.empty();
            }
            context = parser.parse(input);
        }
        if (!(context instanceof Value.MapValue map)) {
            throw new IOException("Context must be a JSON object");
        }
        return Context.of(map);
    }
}
