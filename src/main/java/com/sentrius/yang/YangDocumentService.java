package com.sentrius.yang;

import com.sentrius.yang.model.BatchParseResult;
import com.sentrius.yang.model.FileParseResult;
import com.sentrius.yang.model.ParseResult;
import com.sentrius.yang.model.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single and batch parsing of YANG documents.
 *
 * <p>Batch parsing runs each document through the {@link ParseCoordinator}, then
 * builds the dependency graph from the collected imports. With a parallelism
 * above one, documents are parsed on a worker pool and the results are merged
 * on the calling thread in input order. Files are keyed by name, so a later file
 * with the same name replaces the dependencies of an earlier one.
 */
public class YangDocumentService implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(YangDocumentService.class);

    private final ParseCoordinator coordinator;
    private final DependencyGraphBuilder graphBuilder;
    private final String defaultFilename;
    private final ExecutorService executor;

    public YangDocumentService(YangExplorerConfiguration configuration) {
        this(new ParseCoordinator(configuration), new DependencyGraphBuilder(),
            configuration.getDefaultFilename(), configuration.getBatchParallelism());
    }

    public YangDocumentService(ParseCoordinator coordinator, DependencyGraphBuilder graphBuilder,
                               String defaultFilename, int parallelism) {
        this.coordinator = coordinator;
        this.graphBuilder = graphBuilder;
        this.defaultFilename = defaultFilename;
        this.executor = parallelism > 1 ? Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory()) : null;
    }

    public ParseResult parse(String content, String filename) {
        return coordinator.parseDocument(content, filename);
    }

    public BatchParseResult parseMultiple(List<SourceFile> files) {
        List<FileParseResult> results = executor != null ? parseOnPool(files) : parseSequentially(files);

        Map<String, List<String>> dependencies = new LinkedHashMap<>();
        for (FileParseResult file : results) {
            List<String> previous = dependencies.put(file.getFilename(), file.getResult().getMetadata().getImports());
            if (previous != null) {
                logger.warn("Duplicate filename {} in batch; dependencies of the earlier file are replaced",
                    file.getFilename());
            }
        }

        BatchParseResult batch = new BatchParseResult(results, dependencies, graphBuilder.build(dependencies));
        logger.debug("Parsed batch of {} file(s): {} valid, {} error(s)", batch.getSummary().getTotalModules(),
            batch.getSummary().getValidModules(), batch.getSummary().getTotalErrors());
        return batch;
    }

    private List<FileParseResult> parseSequentially(List<SourceFile> files) {
        List<FileParseResult> results = new ArrayList<>();
        for (SourceFile file : files) {
            results.add(parseFile(file));
        }
        return results;
    }

    private List<FileParseResult> parseOnPool(List<SourceFile> files) {
        List<Future<FileParseResult>> futures = new ArrayList<>();
        for (SourceFile file : files) {
            futures.add(executor.submit(() -> parseFile(file)));
        }

        List<FileParseResult> results = new ArrayList<>();
        for (Future<FileParseResult> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(pending -> pending.cancel(true));
                throw new IllegalStateException("Interrupted while parsing batch", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Batch worker failed", e.getCause());
            }
        }
        return results;
    }

    private FileParseResult parseFile(SourceFile file) {
        String filename = file.getName() != null && !file.getName().isBlank() ? file.getName() : defaultFilename;
        return new FileParseResult(filename, coordinator.parseDocument(file.getContent(), filename));
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "yang-parse-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
