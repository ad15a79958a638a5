package org.apache.nifi.controllers.vfs.attribute;

import org.apache.nifi.controllers.vfs.VirtualFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Applies a {@link CopyAttributesSpec} between two files.
 */
public final class AttributeCopier {

    private static final Logger LOGGER = LoggerFactory.getLogger(AttributeCopier.class);

    private AttributeCopier() {
    }

    /**
     * Transfers every attribute kind present on both files, as the instructions resolve it.
     * Kinds present on only one side are left alone.
     *
     * @param source the file whose metadata is read
     * @param target the file whose metadata is written
     * @param spec the per-kind instructions
     * @throws IOException if a transfer fails
     */
    public static void copy(VirtualFile source, VirtualFile target, CopyAttributesSpec spec) throws IOException {
        Map<AttributeKind<?>, AttributeSet> sourceSets = source.getAttributes();
        if (sourceSets.isEmpty()) {
            return;
        }
        Map<AttributeKind<?>, AttributeSet> targetSets = target.getAttributes();

        for (Map.Entry<AttributeKind<?>, AttributeSet> entry : sourceSets.entrySet()) {
            AttributeSet targetSet = targetSets.get(entry.getKey());
            if (targetSet == null) {
                LOGGER.debug("Target {} has no {} attributes", target.getPath(), entry.getKey());
                continue;
            }

            AttributePolicy policy = spec.resolve(entry.getValue());
            if (policy.isSkipped()) {
                continue;
            }

            LOGGER.debug("Copying {} attributes from {} to {} ({})",
                    entry.getKey(), source.getPath(), target.getPath(), policy);
            policy.apply(entry.getValue(), targetSet);
        }
    }
}
