package work.lcod.strata.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import picocli.CommandLine;
import work.lcod.strata.api.LoadOptions;
import work.lcod.strata.api.LogLevel;
import work.lcod.strata.api.SourceFormat;
import work.lcod.strata.api.TreeLoader;
import work.lcod.strata.format.TreeJson;
import work.lcod.strata.tree.Node;
import work.lcod.strata.tree.NodeList;
import work.lcod.strata.tree.Reply;

@CommandLine.Command(
    name = "strata",
    description = "Load stacked configuration files and query keys or settings.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class StrataCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-f", "--file"},
        required = true,
        paramLabel = "PATH",
        description = "Config file to load (.conf, .json, .yaml, .toml); repeat to load several."
    )
    private List<Path> files = new ArrayList<>();

    @CommandLine.Option(
        names = "--stack",
        description = "Load each file into a new scope over the previous ones."
    )
    private boolean stacked;

    @CommandLine.Option(
        names = {"-s", "--set"},
        paramLabel = "KEY=VALUE",
        description = "Override applied in a final scope; typed keys such as port:int=80 are accepted."
    )
    private List<String> overrides = new ArrayList<>();

    @CommandLine.Option(
        names = "--format",
        description = "Format of every file instead of detecting it from the extension (${COMPLETION-CANDIDATES}).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private SourceFormat format;

    @CommandLine.Option(
        names = "--lenient",
        description = "Skip unrecognized lines in .conf files instead of failing."
    )
    private boolean lenient;

    @CommandLine.Option(
        names = "--json",
        description = "Print matches as JSON."
    )
    private boolean json;

    @CommandLine.Option(
        names = "--settings",
        paramLabel = "SPEC",
        description = "Evaluate the settings groups matched by SPEC.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String settingsSpec;

    @CommandLine.Option(
        names = {"-C", "--context"},
        paramLabel = "KEY=VALUE",
        description = "Context value for --settings."
    )
    private Map<String, String> context = new LinkedHashMap<>();

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Parameters(
        paramLabel = "KEY",
        description = "Key specs to print, '*' matching any key; prints the whole tree when omitted."
    )
    private List<String> keys = new ArrayList<>();

    @Override
    public Integer call() throws Exception {
        LogLevel.from(logLevelRaw).install();

        LoadOptions options = LoadOptions.builder()
            .sources(files)
            .stacked(stacked)
            .overrides(overrides)
            .format(format)
            .strict(!lenient)
            .build();
        Node tree = new TreeLoader().load(options);
        PrintWriter out = spec.commandLine().getOut();

        if (settingsSpec != null) {
            printSettings(out, tree);
            return 0;
        }
        if (keys.isEmpty()) {
            printNode(out, tree.inheritedRoot() == null ? tree : TreeLoader.flatten(tree));
            return 0;
        }

        int exitCode = 0;
        for (String key : keys) {
            NodeList matches = tree.getNodes(key);
            if (matches.isEmpty()) {
                spec.commandLine().getErr().println("no match: " + key);
                exitCode = 1;
                continue;
            }
            for (Node match : matches) {
                printNode(out, match);
            }
        }
        out.flush();
        return exitCode;
    }

    private void printSettings(PrintWriter out, Node tree) throws IOException {
        Node scope = context.isEmpty() ? tree : tree.with(context);
        Reply reply = scope.getSettings(settingsSpec);
        if (json) {
            out.println(JSON_WRITER.writeValueAsString(reply.asMap()));
        } else {
            for (String key : reply.keys()) {
                for (String value : reply.values(key)) {
                    out.println(key + "=" + value);
                }
            }
        }
        out.flush();
    }

    private void printNode(PrintWriter out, Node node) throws IOException {
        if (json) {
            out.println(TreeJson.encode(node, true));
        } else {
            StringWriter text = new StringWriter();
            node.dump(text, false);
            out.print(text);
        }
        out.flush();
    }
}
