package io.studiograph.core.export;

import static io.studiograph.core.Fixtures.fromHub;
import static io.studiograph.core.Fixtures.hub;
import static org.assertj.core.api.Assertions.assertThat;

import io.studiograph.core.config.DefinitionSettings;
import io.studiograph.core.model.AssignSlot;
import io.studiograph.core.model.AutomationLane;
import io.studiograph.core.model.AutomationType;
import io.studiograph.core.model.CcMapping;
import io.studiograph.core.model.DrumLane;
import io.studiograph.core.model.Instrument;
import io.studiograph.core.model.InstrumentType;
import io.studiograph.core.model.NrpnMapping;
import io.studiograph.core.model.PortType;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link DefinitionSerializer}.
 * <p>
 * Coverage:
 * - Exact layout of a minimal definition
 * - CC and NRPN sections grouped by section name
 * - ASSIGN, AUTOMATION and DRUMLANES formats
 * - OUTCHAN NULL on analog routes
 * - renderAll file naming and suffixes
 * - Settings drive VERSION, attribution and the default section
 */
class DefinitionSerializerTest {

    private final DefinitionSerializer serializer = new DefinitionSerializer();

    private static DeviceDefinition minimal(InstrumentType type, String outPort, Integer outChannel) {
        return new DeviceDefinition(
            "TestSynth", "TestMfr", "TestSynth", type, outPort, outChannel,
            List.of(), List.of(), List.of(), List.of(), List.of());
    }

    private static DeviceDefinition minimal() {
        return minimal(InstrumentType.POLY, "A", 1);
    }

    private static Instrument synth(String id, String name) {
        return Instrument.builder()
            .id(id)
            .name(name)
            .manufacturer("Mfr")
            .channel(5)
            .removable(true)
            .build();
    }

    private static String section(String output, String name) {
        return output.split("\\[" + name + "]\n")[1].split("\\[/" + name + "]")[0];
    }

    // =========================================================================
    // Layout
    // =========================================================================

    @Test
    void render_minimalDefinition_matchesHubFormat() {
        String expected = """
            ############# TESTMFR TESTSYNTH #############
            VERSION 1
            TRACKNAME TestSynth
            TYPE POLY
            OUTPORT A
            OUTCHAN 1
            INPORT NULL
            INCHAN NULL
            MAXRATE NULL

            [DRUMLANES]
            [/DRUMLANES]

            [PC]
            [/PC]

            [CC]
            [/CC]

            [NRPN]
            [/NRPN]

            [ASSIGN]
            [/ASSIGN]

            [AUTOMATION]
            [/AUTOMATION]

            [COMMENT]
            TestMfr TestSynth
            Generated by StudioGraph
            [/COMMENT]""";

        assertThat(serializer.render(minimal())).isEqualTo(expected);
    }

    @Test
    void render_neverEndsWithNewline() {
        assertThat(serializer.render(minimal())).endsWith("[/COMMENT]").doesNotContain("\r");
    }

    @Test
    void render_analogRoute_writesNullChannel() {
        String output = serializer.render(minimal(InstrumentType.POLY, "CV1", null));

        assertThat(output).contains("OUTPORT CV1\nOUTCHAN NULL\n");
    }

    // =========================================================================
    // Sections
    // =========================================================================

    @Test
    void render_ccMappings_groupedBySectionInFirstSeenOrder() {
        DeviceDefinition definition = new DeviceDefinition(
            "TestSynth", "TestMfr", "TestSynth", InstrumentType.POLY, "A", 1,
            List.of(
                new CcMapping(74, "FltCutoff", null, "Filter", null),
                new CcMapping(5, "Portamento", null, "Global", null),
                new CcMapping(71, "FltReso", null, "Filter", null),
                new CcMapping(7, "Volume", null, null, null)),
            List.of(), List.of(), List.of(), List.of());

        assertThat(section(serializer.render(definition), "CC")).isEqualTo(
            "# Filter\n74 FltCutoff\n71 FltReso\n\n"
                + "# Global\n5 Portamento\n\n"
                + "# General\n7 Volume\n\n");
    }

    @Test
    void render_nrpnMappings_useMsbLsbSevenFormat() {
        DeviceDefinition definition = new DeviceDefinition(
            "TestSynth", "TestMfr", "TestSynth", InstrumentType.POLY, "A", 1,
            List.of(),
            List.of(new NrpnMapping(0, 42, "OscShape", "Oscillator", null)),
            List.of(), List.of(), List.of());

        assertThat(section(serializer.render(definition), "NRPN")).isEqualTo("# Oscillator\n0:42:7 OscShape\n\n");
    }

    @Test
    void render_assignSlots_writeCcNameAndDefault() {
        DeviceDefinition definition = new DeviceDefinition(
            "TestSynth", "TestMfr", "TestSynth", InstrumentType.POLY, "A", 1,
            List.of(), List.of(),
            List.of(new AssignSlot(1, 74, "Cutoff", 64), new AssignSlot(2, 71, "Reso", 0)),
            List.of(), List.of());

        assertThat(section(serializer.render(definition), "ASSIGN")).isEqualTo("74 Cutoff 64\n71 Reso 0\n");
    }

    @Test
    void render_automationLanes_useTypeSpecificFormats() {
        DeviceDefinition definition = new DeviceDefinition(
            "TestSynth", "TestMfr", "TestSynth", InstrumentType.POLY, "A", 1,
            List.of(), List.of(), List.of(),
            List.of(
                AutomationLane.cc(1, 74),
                AutomationLane.pitchBend(2),
                AutomationLane.aftertouch(3),
                AutomationLane.cv(4, 2),
                AutomationLane.nrpn(5, 1, 42, 14)),
            List.of());

        assertThat(section(serializer.render(definition), "AUTOMATION"))
            .isEqualTo("CC:74\nPB:\nAT:\nCV:2\nNRPN:1:42:14\n");
    }

    @Test
    void render_automationLanesWithoutPayload_useDefaults() {
        DeviceDefinition definition = new DeviceDefinition(
            "TestSynth", "TestMfr", "TestSynth", InstrumentType.POLY, "A", 1,
            List.of(), List.of(), List.of(),
            List.of(
                new AutomationLane(1, AutomationType.CC, null, null, null, null, null),
                new AutomationLane(2, AutomationType.CV, null, null, null, null, null),
                new AutomationLane(3, AutomationType.NRPN, null, null, null, null, null)),
            List.of());

        assertThat(section(serializer.render(definition), "AUTOMATION")).isEqualTo("CC:0\nCV:1\nNRPN:0:0:7\n");
    }

    @Test
    void render_drumLanes_sortedDescendingByLane() {
        DeviceDefinition definition = new DeviceDefinition(
            "TestSynth", "TestMfr", "TestSynth", InstrumentType.DRUM, "A", 10,
            List.of(), List.of(), List.of(), List.of(),
            List.of(
                new DrumLane(1, 36, "10", 36, "Kick"),
                new DrumLane(3, 42, "10", 42, "HiHat"),
                new DrumLane(2, 38, "10", 38, "Snare")));

        assertThat(section(serializer.render(definition), "DRUMLANES"))
            .isEqualTo("3:42:10:42 HiHat\n2:38:10:38 Snare\n1:36:10:36 Kick\n");
    }

    @Test
    void render_drumLaneWithoutValues_writesNull() {
        DeviceDefinition definition = new DeviceDefinition(
            "TestSynth", "TestMfr", "TestSynth", InstrumentType.DRUM, "A", 10,
            List.of(), List.of(), List.of(), List.of(),
            List.of(new DrumLane(1, null, null, null, "Empty")));

        assertThat(serializer.render(definition)).contains("1:NULL:NULL:NULL Empty");
    }

    @Test
    void render_drumLanesOnPolyTrack_areOmitted() {
        DeviceDefinition definition = new DeviceDefinition(
            "TestSynth", "TestMfr", "TestSynth", InstrumentType.POLY, "A", 1,
            List.of(), List.of(), List.of(), List.of(),
            List.of(DrumLane.of(1, 36, "Kick")));

        assertThat(serializer.render(definition)).contains("[DRUMLANES]\n[/DRUMLANES]");
    }

    // =========================================================================
    // Settings
    // =========================================================================

    @Test
    void render_customSettings_changeVersionAttributionAndDefaultSection() {
        DefinitionSerializer custom = new DefinitionSerializer(
            new DefinitionSettings(2, 8, "Misc", "Exported by test", ".def"));
        DeviceDefinition definition = new DeviceDefinition(
            "TestSynth", "TestMfr", "TestSynth", InstrumentType.POLY, "A", 1,
            List.of(new CcMapping(1, "ModWheel", null, "", null)),
            List.of(), List.of(), List.of(), List.of());

        String output = custom.render(definition);

        assertThat(output)
            .contains("VERSION 2\n")
            .contains("# Misc\n1 ModWheel")
            .endsWith("TestMfr TestSynth\nExported by test\n[/COMMENT]");
    }

    @Test
    void render_instrument_usesTrackNameWithoutSuffix() {
        String output = serializer.render(synth("node-1", "My Synth"), "CV1", true);

        assertThat(output)
            .contains("TRACKNAME MySynth\n")
            .contains("OUTPORT CV1\nOUTCHAN NULL\n");
    }

    // =========================================================================
    // renderAll
    // =========================================================================

    @Test
    void renderAll_oneFilePerConnectedInstrument() {
        Instrument one = synth("node-1", "Synth One");
        Instrument two = synth("node-2", "Synth Two");

        List<DefinitionFile> files = serializer.renderAll(
            List.of(hub(), one, two),
            List.of(fromHub("midi-a", "node-1", PortType.MIDI), fromHub("midi-b", "node-2", PortType.MIDI)));

        assertThat(files).extracting(DefinitionFile::instrumentId).containsExactly("node-1", "node-2");
        assertThat(files).extracting(DefinitionFile::filename).containsExactly("Synth_One.txt", "Synth_Two.txt");
        assertThat(files.get(0).content()).contains("OUTPORT A\nOUTCHAN 5\n");
    }

    @Test
    void renderAll_longName_truncatesTrackName() {
        List<DefinitionFile> files = serializer.renderAll(
            List.of(hub(), synth("node-1", "Very Long Synth Name Here")),
            List.of(fromHub("midi-a", "node-1", PortType.MIDI)));

        assertThat(files.get(0).content()).contains("TRACKNAME VeryLongSynt\n");
    }

    @Test
    void renderAll_specialCharacters_sanitizeFilename() {
        List<DefinitionFile> files = serializer.renderAll(
            List.of(hub(), synth("node-1", "My Synth! #2")),
            List.of(fromHub("midi-a", "node-1", PortType.MIDI)));

        assertThat(files.get(0).filename()).isEqualTo("My_Synth___2.txt");
    }

    @Test
    void renderAll_multipleRoutes_suffixTrackAndFileNames() {
        List<DefinitionFile> files = serializer.renderAll(
            List.of(hub(), synth("node-1", "MySynth")),
            List.of(fromHub("midi-a", "node-1", PortType.MIDI), fromHub("cv-1", "node-1", PortType.CV)));

        assertThat(files).extracting(DefinitionFile::filename).containsExactly("MySynth_A.txt", "MySynth_CV1.txt");
        assertThat(files.get(0).content()).contains("TRACKNAME MySynth_A\n");
        assertThat(files.get(1).content()).contains("TRACKNAME MySynth_CV1\n").contains("OUTCHAN NULL");
    }

    @Test
    void renderAll_singleRoute_hasNoSuffix() {
        List<DefinitionFile> files = serializer.renderAll(
            List.of(hub(), synth("node-1", "MySynth")),
            List.of(fromHub("midi-a", "node-1", PortType.MIDI)));

        assertThat(files).singleElement().satisfies(file -> {
            assertThat(file.filename()).isEqualTo("MySynth.txt");
            assertThat(file.content()).contains("TRACKNAME MySynth\n");
        });
    }

    @Test
    void renderAll_sameNameOnTwoInstruments_keepsFilenamesDistinct() {
        List<DefinitionFile> files = serializer.renderAll(
            List.of(hub(), synth("node-1", "Minilogue"), synth("node-2", "Minilogue")),
            List.of(fromHub("midi-a", "node-1", PortType.MIDI), fromHub("midi-b", "node-2", PortType.MIDI)));

        assertThat(files).extracting(DefinitionFile::filename)
            .containsExactly("Minilogue.txt", "Minilogue_B.txt");
        assertThat(files.get(1).content()).contains("TRACKNAME Minilogue\n").contains("OUTPORT B\n");
    }

    @Test
    void renderAll_sameNameOnSamePort_fallsBackToCounter() {
        List<DefinitionFile> files = serializer.renderAll(
            List.of(hub(), synth("node-1", "Mini"), synth("node-2", "Mini"), synth("node-3", "Mini")),
            List.of(
                fromHub("midi-a", "node-1", PortType.MIDI),
                fromHub("midi-b", "node-2", PortType.MIDI),
                fromHub("midi-b", "node-3", PortType.MIDI)));

        assertThat(files).extracting(DefinitionFile::filename)
            .containsExactly("Mini.txt", "Mini_B.txt", "Mini_2.txt")
            .doesNotHaveDuplicates();
    }

    @Test
    void renderAll_nothingConnected_returnsEmpty() {
        assertThat(serializer.renderAll(List.of(hub(), synth("node-1", "Lonely")), List.of())).isEmpty();
    }
}
