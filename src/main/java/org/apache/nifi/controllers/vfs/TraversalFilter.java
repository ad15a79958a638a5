package org.apache.nifi.controllers.vfs;

import java.io.IOException;
import java.util.function.Predicate;

/**
 * Decides, per file, whether a recursive walk yields the file and whether it descends into it.
 */
@FunctionalInterface
public interface TraversalFilter {

    TraversalFilter ALL = file -> TraversalOutcome.BOTH;

    TraversalOutcome evaluate(ListableFile file) throws IOException;

    /**
     * Adapts a yes/no predicate: accepted files are yielded and descended into, rejected ones are skipped.
     */
    static TraversalFilter of(Predicate<? super ListableFile> predicate) {
        return file -> TraversalOutcome.of(predicate.test(file));
    }
}
