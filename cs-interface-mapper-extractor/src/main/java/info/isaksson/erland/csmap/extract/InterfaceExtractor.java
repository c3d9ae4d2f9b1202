package info.isaksson.erland.csmap.extract;

import info.isaksson.erland.csmap.io.SourceReader;
import info.isaksson.erland.csmap.io.SourceText;
import info.isaksson.erland.csmap.model.CsModel;
import info.isaksson.erland.csmap.model.CsUnit;
import info.isaksson.erland.csmap.model.UnitParseFailure;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Parses C# source units into a {@link CsModel}.
 *
 * <p>Small orchestrator over the helpers in this package:</p>
 * <ul>
 *   <li>{@link SourceUnitParser}: one unit at a time, run in parallel on a fixed pool</li>
 *   <li>{@link DependencyResolver}: cross-unit edges, after every unit is parsed</li>
 * </ul>
 *
 * <p>A unit that cannot be parsed is recorded in {@link CsModel#failures} and the remaining
 * units are processed normally. Unit order in the model follows input order regardless of
 * which worker finished first.</p>
 */
public final class InterfaceExtractor {

    private static final Logger logger = LogManager.getLogger(InterfaceExtractor.class);

    private final ExtractionOptions options;
    private final Function<SourceText, CsUnit> parser;

    public InterfaceExtractor() {
        this(new ExtractionOptions());
    }

    public InterfaceExtractor(ExtractionOptions options) {
        this(options, null);
    }

    InterfaceExtractor(ExtractionOptions options, Function<SourceText, CsUnit> parser) {
        this.options = options == null ? new ExtractionOptions() : options;
        this.parser = parser != null ? parser : new SourceUnitParser(this.options)::parse;
    }

    /** Read and parse {@code files}; unreadable files become failures. */
    public CsModel extractFiles(Path sourceRoot, List<Path> files) {
        List<SourceText> sources = new ArrayList<>();
        List<UnitParseFailure> readFailures = new ArrayList<>();
        for (Path file : files) {
            try {
                sources.add(SourceReader.read(sourceRoot, file));
            } catch (IOException e) {
                String id = SourceReader.relativeId(sourceRoot, file);
                logger.warn("Cannot read {}: {}", id, e.getMessage());
                readFailures.add(new UnitParseFailure(id, "read failed: " + e.getMessage()));
            }
        }
        CsModel model = extract(sources);
        model.failures.addAll(readFailures);
        model.failures.sort(Comparator.comparing(f -> f.unitId));
        return model;
    }

    public CsModel extract(List<SourceText> sources) {
        CsModel model = new CsModel();
        if (sources == null || sources.isEmpty()) return model;

        for (Outcome outcome : parseAll(sources)) {
            if (outcome.unit != null) model.units.add(outcome.unit);
            else model.failures.add(outcome.failure);
        }

        model.dependencyEdges.addAll(DependencyResolver.resolve(model.units));
        logger.info("Parsed {} unit(s), {} type(s), {} edge(s), {} failure(s)",
                model.units.size(), model.typeCount(), model.dependencyEdges.size(), model.failures.size());
        return model;
    }

    private List<Outcome> parseAll(List<SourceText> sources) {
        int poolSize = Math.max(1, Math.min(options.threads, sources.size()));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, new ParseThreadFactory());
        try {
            List<Future<Outcome>> futures = new ArrayList<>(sources.size());
            for (SourceText source : sources) {
                futures.add(pool.submit(() -> parseOne(source)));
            }
            List<Outcome> out = new ArrayList<>(sources.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    out.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    String id = sources.get(i).id;
                    logger.warn("Parse task for {} failed", id, e.getCause());
                    out.add(Outcome.failed(id, describe(e.getCause())));
                }
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while parsing sources", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private Outcome parseOne(SourceText source) {
        try {
            return Outcome.parsed(parser.apply(source));
        } catch (RuntimeException | StackOverflowError e) {
            String message = describe(e);
            logger.warn("Failed to parse {}: {}", source.id, message);
            return Outcome.failed(source.id, message);
        }
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown error";
        String msg = t.getMessage();
        return msg == null || msg.isBlank() ? t.getClass().getSimpleName() : t.getClass().getSimpleName() + ": " + msg;
    }

    private static final class Outcome {
        final CsUnit unit;
        final UnitParseFailure failure;

        private Outcome(CsUnit unit, UnitParseFailure failure) {
            this.unit = unit;
            this.failure = failure;
        }

        static Outcome parsed(CsUnit unit) {
            return new Outcome(unit, null);
        }

        static Outcome failed(String unitId, String message) {
            return new Outcome(null, new UnitParseFailure(unitId, message));
        }
    }

    private static final class ParseThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "csmap-parse-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
