package com.sheetdoc.app.evaluation;

import com.sheetdoc.app.models.PageReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Looks up the page behind an {@code @[Label](id)} mention.
 * Returning null means the page is not available; the referencing cell then
 * records an error instead of failing the pass.
 */
@FunctionalInterface
public interface ExternalReferenceResolver {

    ExternalResolution resolve(PageReference reference);

    /**
     * Adapts an asynchronous lookup. The evaluation pass waits for each
     * future before continuing the cell that needs it. A lookup that throws,
     * or a future that fails or is cancelled, fails only that mention.
     */
    static ExternalReferenceResolver awaiting(
            Function<PageReference, CompletableFuture<ExternalResolution>> lookup) {
        Logger logger = LoggerFactory.getLogger(ExternalReferenceResolver.class);
        return reference -> {
            try {
                return lookup.apply(reference).join();
            } catch (CancellationException e) {
                logger.warn("Resolving {} was cancelled", reference.getRaw());
                return unavailable(reference, "lookup was cancelled");
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                logger.warn("Resolving {} failed: {}", reference.getRaw(), cause.getMessage());
                return unavailable(reference, cause.getMessage());
            } catch (RuntimeException e) {
                logger.warn("Resolving {} failed: {}", reference.getRaw(), e.getMessage());
                return unavailable(reference, e.getMessage());
            }
        };
    }

    private static ExternalResolution unavailable(PageReference reference, String reason) {
        return ExternalResolution.failed(reference.getRaw(), reference.getLabel(),
                "Referenced page \"" + reference.getLabel() + "\" could not be loaded: " + reason);
    }
}
