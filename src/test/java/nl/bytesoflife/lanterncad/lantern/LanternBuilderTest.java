package nl.bytesoflife.lanterncad.lantern;

import nl.bytesoflife.lanterncad.LanternCadException;
import nl.bytesoflife.lanterncad.circuit.CircuitModel;
import nl.bytesoflife.lanterncad.circuit.LaunchField;
import nl.bytesoflife.lanterncad.circuit.LaunchType;
import nl.bytesoflife.lanterncad.circuit.Segment;
import nl.bytesoflife.lanterncad.geometry.Arrangement;
import nl.bytesoflife.lanterncad.geometry.LayoutException;
import nl.bytesoflife.lanterncad.geometry.RingLayer;
import nl.bytesoflife.lanterncad.ind.IndDocument;
import nl.bytesoflife.lanterncad.ind.IndParser;
import nl.bytesoflife.lanterncad.mode.ModeConfigurationException;
import nl.bytesoflife.lanterncad.taper.TaperProfiles;
import nl.bytesoflife.lanterncad.taper.TaperValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LanternBuilderTest {

    @TempDir
    Path dataDir;

    private static LanternParameters fiveCores() {
        return LanternParameters.builder()
                .coreCount(5)
                .taperFactor(5)
                .build();
    }

    @Test
    void photonicLanternEndToEnd() throws IOException {
        LanternBuilder builder = LanternBuilder.photonic();
        assertEquals(LanternState.UNINITIALIZED, builder.getState());

        LanternSummary summary = builder.createLantern(fiveCores());

        assertEquals(LanternState.TAPERS_APPLIED, builder.getState());
        assertEquals(5, summary.coreCount());
        assertEquals(List.of("0", "1", "2", "3", "4"), List.copyOf(summary.cores().keySet()));
        assertTrue(summary.modeMap().isEmpty());
        assertEquals(2 * 106.33 + 125, summary.capillaryDiameter(), 0.02);

        // five cores, five claddings, one capillary
        assertEquals(11, builder.getCircuit().getSegments().size());
        assertEquals(6, builder.getCircuit().getPathways().size());
        assertEquals(6, builder.getCircuit().getMonitors().size());
        assertEquals(11, builder.getTaperModel().size());

        builder.launchDefault(LaunchType.GAUSSIAN);
        assertEquals(LanternState.CIRCUIT_POPULATED, builder.getState());

        DesignHandle handle = builder.write(dataDir);

        assertEquals(LanternState.WRITTEN, builder.getState());
        assertEquals("photonic_lantern_5_cores_0.ind", handle.fileName());
        assertEquals(dataDir.resolve("photonic_lantern_5_cores"), handle.directory());
        assertTrue(Files.exists(handle.path()));
        assertEquals(5, handle.cores().size());
        assertEquals(10.4, handle.cores().get("0").coreDiameter(), 1e-9);
        assertEquals(125, handle.cores().get("0").claddingDiameter(), 1e-9);

        IndDocument document = new IndParser().parse(handle.path());
        assertEquals(11, document.getSegments().size());
        assertEquals("0_CORE", document.getSegment(1).get("comp_name"));
        assertEquals("0_CLADDING", document.getSegment(6).get("comp_name"));
        assertEquals("CAPILLARY", document.getSegment(11).get("comp_name"));
        assertEquals(1, document.getLaunchFields().size());
        assertEquals("1", document.getLaunchFields().get(0).get("launch_pathway"));
    }

    @Test
    void taperShrinksSegments() {
        LanternBuilder builder = LanternBuilder.photonic();
        builder.createLantern(fiveCores());

        Segment core = builder.getCircuit().getSegments().get(1);
        assertEquals("1_CORE", core.getCompName());
        assertEquals(10.4, core.getNumber("begin.width"), 1e-9);
        assertEquals(2.08, core.getNumber("end.width"), 1e-9);
        assertEquals(core.getNumber("begin.x") / 5, core.getNumber("end.x"), 1e-9);
        assertEquals(80000, core.getNumber("end.z"), 1e-9);
        assertEquals(1.45213 - 1.4345, core.getNumber("begin.delta"), 1e-12);
        assertEquals("TAPER_LINEAR", core.get("width_taper"));
        assertEquals("core-1", core.getTaperName());

        Segment cladding = builder.getCircuit().getSegments().get(6);
        assertEquals(125, cladding.getNumber("begin.width"), 1e-9);
        assertEquals(25, cladding.getNumber("end.width"), 1e-9);
        assertEquals(1.44692 - 1.4345, cladding.getNumber("end.delta"), 1e-12);
    }

    @Test
    void untaperedFibresCarryNoTaperTags() {
        LanternBuilder builder = LanternBuilder.photonic();
        builder.createLantern(LanternParameters.builder().coreCount(3).build());

        Segment core = builder.getCircuit().getSegments().get(0);
        assertNull(core.get("width_taper"));
        assertEquals(core.getNumber("begin.width"), core.getNumber("end.width"), 1e-12);

        Segment capillary = builder.getCircuit().getSegments().get(6);
        assertEquals("CAPILLARY", capillary.getCompName());
        assertEquals("TAPER_LINEAR", capillary.get("width_taper"));
    }

    @Test
    void userProfileGetsNumberedTag() {
        LanternBuilder builder = LanternBuilder.photonic();
        builder.createLantern(LanternParameters.builder()
                .coreCount(3)
                .taperFactor(4)
                .taperProfile(TaperProfiles.SIGMOID)
                .build());

        assertEquals("TAPER_USER_1", builder.getCircuit().getSegments().get(0).get("width_taper"));
    }

    @Test
    void coreAndCladdingTaperIndependently() {
        LanternBuilder builder = LanternBuilder.photonic();
        builder.createLantern(LanternParameters.builder()
                .coreCount(3)
                .taperFactor(4)
                .layerTaper(FiberLayer.CORE, 2, TaperProfiles.EXPONENTIAL)
                .layerTaperProfile(FiberLayer.CLADDING, TaperProfiles.SIGMOID)
                .build());

        Segment core = builder.getCircuit().getSegments().get(0);
        assertEquals(5.2, core.getNumber("end.width"), 1e-9);
        assertEquals("TAPER_EXPONENTIAL", core.get("width_taper"));
        // cores follow their cladding towards the axis
        assertEquals(core.getNumber("begin.x") / 4, core.getNumber("end.x"), 1e-9);

        Segment cladding = builder.getCircuit().getSegments().get(3);
        assertEquals("0_CLADDING", cladding.getCompName());
        assertEquals(31.25, cladding.getNumber("end.width"), 1e-9);
        assertEquals("TAPER_USER_1", cladding.get("width_taper"));
        assertEquals(core.getNumber("end.x"), cladding.getNumber("end.x"), 1e-12);

        Segment capillary = builder.getCircuit().getSegments().get(6);
        assertEquals("TAPER_LINEAR", capillary.get("width_taper"));
        assertEquals(capillary.getNumber("begin.width") / 4, capillary.getNumber("end.width"), 1e-9);

        assertEquals(2, builder.getTaperModel().get("core-0").getTaperFactor(), 1e-12);
        assertSame(TaperProfiles.SIGMOID, builder.getTaperModel().get("cladding-0").getRadiusProfile());
    }

    @Test
    void untaperedLayerCarriesNoTags() {
        LanternBuilder builder = LanternBuilder.photonic();
        builder.createLantern(LanternParameters.builder()
                .coreCount(3)
                .taperFactor(4)
                .layerTaper(FiberLayer.CORE, 1, TaperProfiles.LINEAR)
                .build());

        assertNull(builder.getCircuit().getSegments().get(0).get("width_taper"));
        assertEquals("TAPER_LINEAR", builder.getCircuit().getSegments().get(3).get("width_taper"));
    }

    @Test
    void invalidLayerFactorRollsBack() {
        LanternBuilder builder = LanternBuilder.photonic();

        TaperValidationException e = assertThrows(TaperValidationException.class,
                () -> builder.createLantern(LanternParameters.builder()
                        .coreCount(3)
                        .layerTaper(FiberLayer.CLADDING, 0, TaperProfiles.LINEAR)
                        .build()));
        assertTrue(e.getMessage().contains("cladding"), e.getMessage());
        assertEquals(LanternState.UNINITIALIZED, builder.getState());
    }

    @Test
    void layeredPhotonicLantern() {
        LanternBuilder builder = LanternBuilder.photonic();

        LanternSummary summary = builder.createLantern(LanternParameters.builder()
                .layers(RingLayer.of(1), RingLayer.of(6), RingLayer.of(12))
                .build());

        assertEquals(19, summary.coreCount());
        assertEquals(625, summary.capillaryDiameter(), 1e-9);
        assertTrue(summary.layout().getCore(0).isCenter());
        assertEquals(2 * 19 + 1, builder.getCircuit().getSegments().size());
    }

    @Test
    void layersNeedCircularArrangementAndMatchingCount() {
        LanternBuilder builder = LanternBuilder.photonic();

        assertThrows(LayoutException.class, () -> builder.createLantern(LanternParameters.builder()
                .arrangement(Arrangement.HEXAGONAL)
                .layers(RingLayer.of(1), RingLayer.of(6))
                .build()));
        assertThrows(LayoutException.class, () -> builder.createLantern(LanternParameters.builder()
                .coreCount(5)
                .layers(RingLayer.of(1), RingLayer.of(6))
                .build()));
        assertEquals(LanternState.UNINITIALIZED, builder.getState());
    }

    @Test
    void circuitViewCannotBypassLifecycle() {
        LanternBuilder builder = LanternBuilder.photonic();
        builder.createLantern(fiveCores());

        assertFalse(builder.getCircuit() instanceof CircuitModel);
        assertThrows(UnsupportedOperationException.class,
                () -> builder.getCircuit().getLaunchFields().clear());
        assertSame(builder.getCircuit(), builder.getCircuit());
    }

    @Test
    void exponentialProfileTag() {
        LanternBuilder builder = LanternBuilder.photonic();
        builder.createLantern(LanternParameters.builder()
                .coreCount(3)
                .taperFactor(4)
                .taperProfile(TaperProfiles.EXPONENTIAL)
                .build());

        assertEquals("TAPER_EXPONENTIAL", builder.getCircuit().getSegments().get(0).get("position_taper"));
    }

    @Test
    void modeSelectiveLanternLabelsCores() throws IOException {
        LanternBuilder builder = LanternBuilder.modeSelective();

        LanternSummary summary = builder.createLantern(LanternParameters.builder()
                .modes("LP11", "LP11")
                .build());

        assertEquals(3, summary.coreCount());
        assertEquals(List.of("LP01", "LP11a", "LP11b"), List.copyOf(summary.cores().keySet()));
        assertEquals("LP01", summary.cores().get("LP01").mode());
        assertEquals(0, summary.cores().get("LP01").x(), 1e-12);
        assertEquals("LP01_CORE", builder.getCircuit().getSegments().get(0).getCompName());

        builder.launchDefault(LaunchType.FIBER_MODE);
        LaunchField launch = builder.getCircuit().getLaunchFields().get(0);
        assertSame(builder.getCorePathway("LP11a"), launch.getPathway());
        assertEquals(summary.cores().get("LP11a").x(), (double) launch.getProperties().get("launch_position"), 1e-12);

        DesignHandle handle = builder.write(dataDir);
        assertEquals("mspl_3_cores_0.ind", handle.fileName());
    }

    @Test
    void modeCountMismatchRollsBack() {
        LanternBuilder builder = LanternBuilder.modeSelective();

        assertThrows(ModeConfigurationException.class, () -> builder.createLantern(LanternParameters.builder()
                .coreCount(4)
                .modes("LP11", "LP01")
                .build()));
        assertEquals(LanternState.UNINITIALIZED, builder.getState());
        assertNull(builder.getCircuit());
    }

    @Test
    void unsupportedLaunchModeRollsBack() {
        LanternBuilder builder = LanternBuilder.modeSelective();

        assertThrows(ModeConfigurationException.class, () -> builder.createLantern(LanternParameters.builder()
                .modes("LP11", "LP21")
                .build()));
        assertEquals(LanternState.UNINITIALIZED, builder.getState());

        builder.createLantern(LanternParameters.builder().modes("LP11", "LP01").build());
        assertEquals(LanternState.TAPERS_APPLIED, builder.getState());
    }

    @Test
    void hexagonalModeSelectiveLantern() {
        LanternBuilder builder = LanternBuilder.modeSelective();

        LanternSummary summary = builder.createLantern(LanternParameters.builder()
                .arrangement(Arrangement.HEXAGONAL)
                .modes("LP21", "LP01")
                .build());

        assertEquals(6, summary.coreCount());
        assertTrue(summary.layout().getCore(summary.modeMap().coreFor("LP01")).isCenter());
    }

    @Test
    void perCoreOverrides() {
        LanternBuilder builder = LanternBuilder.photonic();
        builder.createLantern(LanternParameters.builder()
                .coreCount(3)
                .coreDiameter("1", 8.2)
                .coreIndex("1", 1.456)
                .build());

        Segment core = builder.getCircuit().getSegments().get(1);
        assertEquals(8.2, core.getNumber("begin.width"), 1e-12);
        assertEquals(1.456 - 1.4345, core.getNumber("begin.delta"), 1e-12);
        assertEquals(10.4, builder.getCircuit().getSegments().get(0).getNumber("begin.width"), 1e-12);
    }

    @Test
    void unknownOverrideLabelRollsBack() {
        LanternBuilder builder = LanternBuilder.photonic();

        assertThrows(LanternCadException.class, () -> builder.createLantern(LanternParameters.builder()
                .coreCount(3)
                .coreDiameter("LP11a", 8.2)
                .build()));
        assertEquals(LanternState.UNINITIALIZED, builder.getState());
    }

    @Test
    void capillaryMustHoldCladdings() {
        LanternBuilder builder = LanternBuilder.photonic();

        assertThrows(LayoutException.class, () -> builder.createLantern(LanternParameters.builder()
                .coreCount(5)
                .capillaryDiameter(300)
                .build()));
        assertEquals(LanternState.UNINITIALIZED, builder.getState());

        LanternSummary summary = builder.createLantern(LanternParameters.builder()
                .coreCount(5)
                .capillaryDiameter(400)
                .build());
        assertEquals(400, summary.capillaryDiameter());
    }

    @Test
    void rejectsNonPositiveTaperFactor() {
        assertThrows(TaperValidationException.class, () -> LanternBuilder.photonic()
                .createLantern(LanternParameters.builder().coreCount(3).taperFactor(0).build()));
    }

    @Test
    void lifecycleOrderIsEnforced() throws IOException {
        LanternBuilder builder = LanternBuilder.photonic();

        assertThrows(LifecycleException.class, () -> builder.write(dataDir));
        assertThrows(LifecycleException.class, () -> builder.launchDefault(LaunchType.GAUSSIAN));

        builder.createLantern(fiveCores());
        assertThrows(LifecycleException.class, () -> builder.createLantern(fiveCores()));
        assertThrows(IncompleteDesignException.class, () -> builder.write(dataDir));

        builder.launchFromCore("2", LaunchType.GAUSSIAN);
        builder.write(dataDir);
        assertThrows(LifecycleException.class, () -> builder.launchFromCore("0", LaunchType.GAUSSIAN));
    }

    @Test
    void rewritingGivesIdenticalFile() throws IOException {
        LanternBuilder builder = LanternBuilder.photonic();
        builder.createLantern(fiveCores());
        builder.launchDefault(LaunchType.GAUSSIAN);

        DesignHandle first = builder.write(dataDir);
        String before = Files.readString(first.path());
        DesignHandle second = builder.writeTo(dataDir.resolve("copy.ind"));

        assertEquals(before, Files.readString(second.path()));
    }

    @Test
    void unknownLaunchCore() {
        LanternBuilder builder = LanternBuilder.photonic();
        builder.createLantern(fiveCores());

        assertThrows(LanternCadException.class, () -> builder.launchFromCore("7", LaunchType.GAUSSIAN));
    }

    @Test
    void simulationParametersAreWritten() {
        LanternBuilder builder = LanternBuilder.photonic();
        builder.createLantern(LanternParameters.builder()
                .coreCount(3)
                .femNev(6)
                .simParam("grid_size", 0.5)
                .build());

        assertEquals(6, builder.getCircuit().getGlobalParameters().get("fem_nev"));
        assertEquals(0.5, builder.getCircuit().getGlobalParameters().get("grid_size"));
        assertEquals(1.4345, builder.getCircuit().getGlobalParameters().get("background_index"));
    }

    @Test
    void namingScheme() {
        assertEquals("mspl_6_cores", LanternBuilder.designDirectoryName("mspl", 6));
        assertEquals("photonic_lantern_19_cores_best.ind",
                LanternBuilder.designFileName("photonic_lantern", 19, "best", "ind"));
    }

    @Test
    void unknownWriterTag() {
        assertThrows(IllegalArgumentException.class, () -> LanternBuilder.photonic().writer("gds"));
    }
}
