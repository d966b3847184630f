package com.flowcraft.core;

import com.flowcraft.core.api.Flow;
import com.flowcraft.core.api.PathStep;
import com.flowcraft.core.engine.GraphIndex;
import com.flowcraft.core.engine.PathEnumerator;
import com.flowcraft.core.engine.StructuralValidator;
import com.flowcraft.core.engine.ValidationResult;
import com.flowcraft.core.io.FlowSerializer;
import com.flowcraft.core.io.SerializerBackend;
import com.flowcraft.core.util.Slugs;

import java.util.List;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * FlowCheck -- structural certification, path enumeration and canonical
 * serialization of conversational flow graphs.
 *
 * <h2>Model</h2>
 * <p>
 * A {@link Flow} is a directed graph of question, action and message nodes.
 * Edges carry an optional label naming the answer or branch they represent.
 * Conversations start at a <b>root</b> (no inbound edge) and end at a
 * <b>terminal</b> (a message node with no outbound edge).
 *
 * <h3>Operations</h3>
 * <ul>
 * <li>{@link #validate(Flow)}: errors and warnings, valid when no errors.</li>
 * <li>{@link #enumeratePaths(Flow)}: every simple root-to-terminal path.</li>
 * <li>{@link #serialize(Flow)}: diff-stable text for version control.</li>
 * </ul>
 *
 * <p>
 * Every operation is a pure function of its input. Instances are immutable
 * and safe to share between threads.
 */
public final class FlowCheck {
    private static final Logger log = LogManager.getLogger(FlowCheck.class);

    private final StructuralValidator validator = new StructuralValidator();
    private final SerializerBackend backend;
    private final FlowSerializer serializer;

    /** Uses the backend named by the {@value SerializerBackend#PROPERTY} system property. */
    public FlowCheck() {
        this(SerializerBackend.configured());
    }

    public FlowCheck(SerializerBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.serializer = backend.create();
    }

    public SerializerBackend backend() {
        return backend;
    }

    public GraphIndex buildIndex(Flow flow) {
        return GraphIndex.of(Objects.requireNonNull(flow, "flow"));
    }

    public ValidationResult validate(Flow flow) {
        ValidationResult result = validator.validate(Objects.requireNonNull(flow, "flow"));
        log.info("Flow '{}' is {} ({} errors, {} warnings)", flow.id(), result.valid() ? "valid" : "invalid",
                result.errors().size(), result.warnings().size());
        return result;
    }

    public List<List<PathStep>> enumeratePaths(Flow flow) {
        return new PathEnumerator(buildIndex(flow)).enumerate();
    }

    public String serialize(Flow flow) {
        return serializer.serialize(Objects.requireNonNull(flow, "flow"));
    }

    /**
     * Validation plus path enumeration over a single index, the combined
     * answer a flow editor shows its author.
     */
    public Report analyze(Flow flow) {
        GraphIndex index = buildIndex(flow);
        ValidationResult result = validator.validate(flow, index);
        List<List<PathStep>> paths = new PathEnumerator(index).enumerate();
        log.info("Flow '{}' is {} ({} errors, {} warnings, {} paths)", flow.id(),
                result.valid() ? "valid" : "invalid", result.errors().size(), result.warnings().size(),
                paths.size());
        return new Report(result.valid(), result.errors(), result.warnings(), paths);
    }

    /**
     * Canonical text plus a download file name derived from the flow name
     * (or id).
     */
    public Export export(Flow flow) {
        String text = serialize(flow);
        return new Export(text, fileName(flow));
    }

    static String fileName(Flow flow) {
        String base = !flow.name().isEmpty() ? flow.name() : !flow.id().isEmpty() ? flow.id() : "flow";
        return Slugs.slugify(base, "flow") + ".yaml";
    }

    /** Result of {@link #analyze(Flow)}. */
    public record Report(boolean valid, List<String> errors, List<String> warnings, List<List<PathStep>> paths) {
        public Report {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
            paths = List.copyOf(paths);
        }
    }

    /** Result of {@link #export(Flow)}. */
    public record Export(String text, String fileName) {
    }
}
