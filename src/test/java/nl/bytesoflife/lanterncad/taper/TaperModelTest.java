package nl.bytesoflife.lanterncad.taper;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaperModelTest {

    @Test
    void keepsRegistrationOrder() {
        TaperModel model = new TaperModel()
                .register(TaperSpec.linear("b", 0, 10, 2, 1, 1.45))
                .register(TaperSpec.linear("a", 0, 10, 2, 1, 1.45));

        assertEquals(2, model.size());
        assertEquals("b", model.getTapers().get(0).getName());
        assertEquals("a", model.getTapers().get(1).getName());
        assertTrue(model.contains("a"));
        assertSame(model.getTapers().get(1), model.get("a"));
    }

    @Test
    void rejectsDuplicateNames() {
        TaperModel model = new TaperModel().register(TaperSpec.linear("core", 0, 10, 2, 1, 1.45));

        assertThrows(TaperValidationException.class, () ->
                model.register(TaperSpec.linear("core", 0, 20, 2, 1, 1.45)));
        assertEquals(10, model.get("core").getZEnd());
    }

    @Test
    void unknownTaperIsAnError() {
        assertThrows(TaperValidationException.class, () -> new TaperModel().get("missing"));
    }

    @Test
    void userTypesNumberedPerProfile() {
        TaperModel model = new TaperModel();
        TaperProfile first = TaperProfiles.tabulated(new double[]{0, 1}, new double[]{0, 1});
        TaperProfile second = TaperProfiles.tabulated(new double[]{0, 0.5, 1}, new double[]{0, 0.8, 1});

        assertEquals("TAPER_USER_1", model.userTypeFor(first).tag());
        assertEquals("TAPER_USER_2", model.userTypeFor(second).tag());
        assertEquals("TAPER_USER_1", model.userTypeFor(first).tag());
    }

    @Test
    void registeredTapersCannotBeModified() {
        TaperModel model = new TaperModel().register(TaperSpec.linear("core", 0, 10, 2, 1, 1.45));

        assertThrows(UnsupportedOperationException.class, () ->
                model.getTapers().add(TaperSpec.linear("other", 0, 10, 2, 1, 1.45)));
    }
}
