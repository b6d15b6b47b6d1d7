package io.studiograph.core.export;

import static io.studiograph.core.Fixtures.HUB;
import static io.studiograph.core.Fixtures.fromHub;
import static io.studiograph.core.Fixtures.hub;
import static io.studiograph.core.Fixtures.instrument;
import static io.studiograph.core.Fixtures.midi;
import static org.assertj.core.api.Assertions.assertThat;

import io.studiograph.core.model.Connection;
import io.studiograph.core.model.Instrument;
import io.studiograph.core.model.PortType;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ConnectionResolver}.
 * <p>
 * Coverage:
 * - Port code mapping for MIDI, USB, CV and gate outputs
 * - CV and gate pairing into CVG codes
 * - Unknown handles and missing hub
 * - Multi-hop routes keep the hub port of origin
 * - Ordering of codes per instrument
 */
class ConnectionResolverTest {

    private static final Instrument SYNTH = instrument("synth", "Synth");
    private static final Instrument BOX = instrument("box", "Thru Box");

    private static List<String> codes(List<ResolvedRoute> routes) {
        return routes.stream().map(ResolvedRoute::hubPortCode).toList();
    }

    // =========================================================================
    // Port codes
    // =========================================================================

    @Test
    void resolve_midiOutputs_mapToLetterCodes() {
        Instrument a = instrument("a");
        Instrument b = instrument("b");
        Instrument c = instrument("c");
        Instrument d = instrument("d");

        List<ResolvedRoute> routes = ConnectionResolver.resolve(
            List.of(hub(), a, b, c, d),
            List.of(
                fromHub("midi-a", "a", PortType.MIDI),
                fromHub("midi-b", "b", PortType.MIDI),
                fromHub("midi-c", "c", PortType.MIDI),
                fromHub("midi-d", "d", PortType.MIDI)));

        assertThat(codes(routes)).containsExactly("A", "B", "C", "D");
        assertThat(routes).noneMatch(ResolvedRoute::analog);
    }

    @Test
    void resolve_usbOutputs_mapToUsbCodes() {
        Instrument a = instrument("a");
        Instrument b = instrument("b");

        List<ResolvedRoute> routes = ConnectionResolver.resolve(
            List.of(hub(), a, b),
            List.of(
                fromHub("usb-host", "a", PortType.USB),
                fromHub("usb-device", "b", PortType.USB)));

        assertThat(codes(routes)).containsExactly("USBH", "USBD");
    }

    @Test
    void resolve_cvOutput_isAnalog() {
        List<ResolvedRoute> routes = ConnectionResolver.resolve(
            List.of(hub(), SYNTH), List.of(fromHub("cv-1", "synth", PortType.CV)));

        assertThat(routes).containsExactly(new ResolvedRoute(SYNTH, "CV1", true));
    }

    @Test
    void resolve_gateOutput_isAnalog() {
        List<ResolvedRoute> routes = ConnectionResolver.resolve(
            List.of(hub(), SYNTH), List.of(fromHub("gate-2", "synth", PortType.CV)));

        assertThat(routes).containsExactly(new ResolvedRoute(SYNTH, "G2", true));
    }

    @Test
    void resolve_cvHandleOverAudioMedium_isNotRouted() {
        Connection audio = Connection.of(HUB, "cv-1", "synth", "midi-in", PortType.AUDIO);

        assertThat(ConnectionResolver.resolve(List.of(hub(), SYNTH), List.of(audio))).isEmpty();
    }

    @Test
    void resolve_cvHandleOverMidiMedium_isTracedAndStaysAnalog() {
        Connection mislabeled = Connection.of(HUB, "cv-1", "synth", "midi-in", PortType.MIDI);

        assertThat(ConnectionResolver.resolve(List.of(hub(), SYNTH), List.of(mislabeled)))
            .containsExactly(new ResolvedRoute(SYNTH, "CV1", true));
    }

    // =========================================================================
    // CV and gate pairing
    // =========================================================================

    @Test
    void resolve_cvAndGateSameNumberSameTarget_combineIntoCvg() {
        List<ResolvedRoute> routes = ConnectionResolver.resolve(
            List.of(hub(), SYNTH),
            List.of(
                fromHub("cv-1", "synth", PortType.CV),
                fromHub("gate-1", "synth", PortType.CV)));

        assertThat(routes).containsExactly(new ResolvedRoute(SYNTH, "CVG1", true));
    }

    @Test
    void resolve_cvAndGateDifferentNumbers_stayApart() {
        List<ResolvedRoute> routes = ConnectionResolver.resolve(
            List.of(hub(), SYNTH),
            List.of(
                fromHub("gate-2", "synth", PortType.CV),
                fromHub("cv-1", "synth", PortType.CV)));

        assertThat(codes(routes)).containsExactly("CV1", "G2");
    }

    @Test
    void resolve_cvAndGateToDifferentTargets_stayApart() {
        Instrument other = instrument("other", "Other");

        List<ResolvedRoute> routes = ConnectionResolver.resolve(
            List.of(hub(), SYNTH, other),
            List.of(
                fromHub("cv-1", "synth", PortType.CV),
                fromHub("gate-1", "other", PortType.CV)));

        assertThat(routes).containsExactly(
            new ResolvedRoute(SYNTH, "CV1", true),
            new ResolvedRoute(other, "G1", true));
    }

    @Test
    void resolve_mixedRoutes_orderTransportThenPairsThenCvThenGates() {
        List<ResolvedRoute> routes = ConnectionResolver.resolve(
            List.of(hub(), SYNTH),
            List.of(
                fromHub("gate-4", "synth", PortType.CV),
                fromHub("cv-3", "synth", PortType.CV),
                fromHub("gate-2", "synth", PortType.CV),
                fromHub("cv-2", "synth", PortType.CV),
                fromHub("midi-a", "synth", PortType.MIDI)));

        assertThat(codes(routes)).containsExactly("A", "CVG2", "CV3", "G4");
    }

    // =========================================================================
    // Traced routes
    // =========================================================================

    @Test
    void resolve_multiHopRoute_keepsOriginatingHubPort() {
        List<ResolvedRoute> routes = ConnectionResolver.resolve(
            List.of(hub(), BOX, SYNTH),
            List.of(fromHub("midi-b", "box", PortType.MIDI), midi("box", "synth")));

        assertThat(routes).containsExactly(
            new ResolvedRoute(BOX, "B", false),
            new ResolvedRoute(SYNTH, "B", false));
    }

    @Test
    void resolve_unknownHandleInTrace_isSkipped() {
        Map<String, Set<String>> trace = Map.of("synth", Set.of("midi-z"));

        assertThat(ConnectionResolver.resolve(List.of(hub(), SYNTH), List.of(), trace)).isEmpty();
    }

    @Test
    void resolve_traceEntryForMissingInstrument_isSkipped() {
        Map<String, Set<String>> trace = Map.of("ghost", Set.of("midi-a"));

        assertThat(ConnectionResolver.resolve(List.of(hub(), SYNTH), List.of(), trace)).isEmpty();
    }

    @Test
    void resolve_withoutHub_returnsEmpty() {
        List<ResolvedRoute> routes = ConnectionResolver.resolve(
            List.of(SYNTH, BOX), List.of(midi("box", "synth")));

        assertThat(routes).isEmpty();
    }

    @Test
    void resolve_duplicateCvConnection_yieldsOneRoute() {
        Connection first = fromHub("cv-1", "synth", PortType.CV);
        Connection second = Connection.of(HUB, "cv-1", "synth", "gate-in", PortType.CV);

        List<ResolvedRoute> routes = ConnectionResolver.resolve(List.of(hub(), SYNTH), List.of(first, second));

        assertThat(codes(routes)).containsExactly("CV1");
    }
}
