package com.sentrius.yang;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentrius.yang.http.YangHttpServer;
import com.sentrius.yang.http.YangJson;
import com.sentrius.yang.model.BatchParseResult;
import com.sentrius.yang.model.SourceFile;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Command line entry point. Parses the given files and prints the batch result
 * as JSON, or serves the HTTP API with {@code --serve}.
 */
public final class Main {

    private Main() {
    }

    public static void main(String[] args) {
        final int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        boolean serve = false;
        final List<Path> inputs = new ArrayList<>();
        final YangExplorerConfiguration configuration = new YangExplorerConfiguration();

        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                printUsage(out);
                return 0;
            }
            if ("--serve".equals(arg)) {
                serve = true;
                continue;
            }
            if (arg.startsWith("--port=")) {
                configuration.setProperty(YangExplorerConfiguration.HTTP_PORT, arg.substring("--port=".length()));
                continue;
            }
            if (arg.startsWith("--primary=")) {
                configuration.setProperty(YangExplorerConfiguration.PRIMARY_PARSER_ENABLED,
                    arg.substring("--primary=".length()));
                continue;
            }
            if (arg.startsWith("--parallelism=")) {
                configuration.setProperty(YangExplorerConfiguration.BATCH_PARALLELISM,
                    arg.substring("--parallelism=".length()));
                continue;
            }
            if (arg.startsWith("--")) {
                err.println("ERROR: unknown argument: " + arg);
                printUsage(err);
                return 2;
            }
            inputs.add(Paths.get(arg));
        }

        try (YangDocumentService service = new YangDocumentService(configuration)) {
            if (serve) {
                return serve(configuration, service);
            }
            if (inputs.isEmpty()) {
                err.println("ERROR: no input files");
                printUsage(err);
                return 2;
            }

            List<SourceFile> files = new ArrayList<>();
            for (Path input : inputs) {
                files.add(new SourceFile(input.getFileName().toString(),
                    Files.readString(input, StandardCharsets.UTF_8)));
            }

            BatchParseResult result = service.parseMultiple(files);
            ObjectMapper mapper = YangJson.prettyMapper();
            out.println(mapper.writeValueAsString(result));
            return result.getSummary().getValidModules() == result.getSummary().getTotalModules() ? 0 : 1;
        } catch (IOException ex) {
            err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return 1;
        }
    }

    private static int serve(YangExplorerConfiguration configuration, YangDocumentService service)
        throws IOException, InterruptedException {
        YangHttpServer server = new YangHttpServer(configuration, service);
        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            shutdown.countDown();
        }, "yang-http-shutdown"));
        server.start();
        shutdown.await();
        return 0;
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: yang-explorer [options] <file.yang>...");
        out.println("       yang-explorer --serve [--port=N]");
        out.println();
        out.println("Options:");
        out.println("  --serve             serve POST /api/yang/parse and /api/yang/parse-multiple");
        out.println("  --port=N            HTTP port (default 3000)");
        out.println("  --primary=false     use the line-oriented fallback parser only");
        out.println("  --parallelism=N     parse batch files on N worker threads");
        out.println("  -h, --help          show this help");
        out.println();
        out.println("Exit code is 0 when every file is valid, 1 otherwise, 2 on usage or IO errors.");
    }

    private static String safeMsg(String s) {
        return s == null ? "" : s;
    }
}
