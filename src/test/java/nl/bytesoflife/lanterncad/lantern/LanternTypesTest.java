package nl.bytesoflife.lanterncad.lantern;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LanternTypesTest {

    @Test
    void createsFreshBuilders() {
        LanternBuilder first = LanternTypes.create(LanternTypes.PHOTONIC);
        LanternBuilder second = LanternTypes.create(LanternTypes.PHOTONIC);

        assertNotSame(first, second);
        assertEquals("photonic_lantern", first.getFilePrefix());
        assertEquals("mspl", LanternTypes.create(LanternTypes.MODE_SELECTIVE).getFilePrefix());
    }

    @Test
    void listsTags() {
        assertEquals(Set.of("photonic", "mode_selective"), LanternTypes.tags());
    }

    @Test
    void unknownTag() {
        assertThrows(IllegalArgumentException.class, () -> LanternTypes.create("planar"));
    }
}
