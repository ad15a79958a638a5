package org.apache.nifi.controllers.vfs.attribute;

import org.apache.nifi.controllers.vfs.VirtualFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Attribute Copy Policy Tests")
public class AttributeCopierTest {

    /**
     * Records which sets received a copy.
     */
    static class RecordingSet implements AttributeSet {
        private final AttributeKind<RecordingSet> kind;
        private final boolean copiedByDefault;
        private final List<String> received = new ArrayList<>();

        RecordingSet(AttributeKind<RecordingSet> kind, boolean copiedByDefault) {
            this.kind = kind;
            this.copiedByDefault = copiedByDefault;
        }

        @Override
        public AttributeKind<?> getKind() {
            return kind;
        }

        @Override
        public void copyTo(AttributeSet target) {
            kind.cast(target).received.add("copied from " + kind);
        }

        @Override
        public boolean isCopiedByDefault() {
            return copiedByDefault;
        }
    }

    private static final AttributeKind<RecordingSet> KIND_A = AttributeKind.of("kind-a", RecordingSet.class);
    private static final AttributeKind<RecordingSet> KIND_B = AttributeKind.of("kind-b", RecordingSet.class);
    private static final AttributeKind<RecordingSet> KIND_C = AttributeKind.of("kind-c", RecordingSet.class);

    private final RecordingSet sourceA = new RecordingSet(KIND_A, true);
    private final RecordingSet sourceB = new RecordingSet(KIND_B, true);
    private final RecordingSet sourceC = new RecordingSet(KIND_C, false);
    private final RecordingSet targetA = new RecordingSet(KIND_A, true);
    private final RecordingSet targetB = new RecordingSet(KIND_B, true);
    private final RecordingSet targetC = new RecordingSet(KIND_C, false);

    private VirtualFile file(RecordingSet... sets) throws IOException {
        Map<AttributeKind<?>, AttributeSet> attributes = new LinkedHashMap<>();
        for (RecordingSet set : sets) {
            attributes.put(set.getKind(), set);
        }
        VirtualFile file = mock(VirtualFile.class);
        when(file.getAttributes()).thenReturn(attributes);
        when(file.getPath()).thenReturn("/file");
        return file;
    }

    @Test
    @DisplayName("Should copy only the listed kind when the fallback skips")
    void testExplicitEntryAndFallback() throws IOException {
        CopyAttributesSpec spec = CopyAttributesSpec.builder()
                .copy(KIND_A)
                .otherwise(false)
                .build();

        AttributeCopier.copy(file(sourceA, sourceB), file(targetA, targetB), spec);

        assertEquals(1, targetA.received.size());
        assertTrue(targetB.received.isEmpty());
    }

    @Test
    @DisplayName("Should follow each kind's default when nothing is listed")
    void testDefaults() throws IOException {
        AttributeCopier.copy(file(sourceA, sourceC), file(targetA, targetC), CopyAttributesSpec.DEFAULT);

        assertEquals(1, targetA.received.size());
        assertTrue(targetC.received.isEmpty());
    }

    @Test
    @DisplayName("Should prefer the explicit entry over the fallback and the default")
    void testPrecedence() throws IOException {
        CopyAttributesSpec spec = CopyAttributesSpec.builder()
                .skip(KIND_A)
                .copy(KIND_C)
                .otherwise(true)
                .build();

        AttributeCopier.copy(file(sourceA, sourceB, sourceC), file(targetA, targetB, targetC), spec);

        assertTrue(targetA.received.isEmpty());
        assertEquals(1, targetB.received.size());
        assertEquals(1, targetC.received.size());
    }

    @Test
    @DisplayName("Should run a custom transfer with source and target")
    void testCustomTransfer() throws IOException {
        List<AttributeSet> seen = new ArrayList<>();
        CopyAttributesSpec spec = CopyAttributesSpec.builder()
                .custom(KIND_A, (source, target) -> {
                    seen.add(source);
                    seen.add(target);
                })
                .build();

        AttributeCopier.copy(file(sourceA), file(targetA), spec);

        assertSame(sourceA, seen.get(0));
        assertSame(targetA, seen.get(1));
        assertTrue(targetA.received.isEmpty());
    }

    @Test
    @DisplayName("Should leave kinds alone that only one side has")
    void testOneSidedKinds() throws IOException {
        AttributeCopier.copy(file(sourceA), file(targetB), CopyAttributesSpec.builder().otherwise(true).build());
        assertTrue(targetB.received.isEmpty());
    }

    @Test
    @DisplayName("Should match kinds by identifier")
    void testKindEquality() {
        assertEquals(KIND_A, AttributeKind.of("kind-a", RecordingSet.class));
        assertNotEquals(KIND_A, KIND_B);
    }
}
