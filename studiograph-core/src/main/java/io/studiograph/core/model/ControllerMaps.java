package io.studiograph.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.experimental.UtilityClass;

/**
 * Ordering and grouping of CC and NRPN parameter lists.
 */
@UtilityClass
public class ControllerMaps {

    public static final String DEFAULT_SECTION = "General";

    private static final Comparator<NrpnMapping> NRPN_ORDER =
        Comparator.comparingInt(NrpnMapping::msb).thenComparingInt(NrpnMapping::lsb);

    /**
     * Sorts by controller number. The sort is stable, so equal numbers keep their order.
     */
    public static List<CcMapping> sortCc(List<CcMapping> mappings) {
        List<CcMapping> sorted = new ArrayList<>(mappings);
        sorted.sort(Comparator.comparingInt(CcMapping::ccNumber));
        return List.copyOf(sorted);
    }

    /**
     * Sorts by MSB, then LSB.
     */
    public static List<NrpnMapping> sortNrpn(List<NrpnMapping> mappings) {
        List<NrpnMapping> sorted = new ArrayList<>(mappings);
        sorted.sort(NRPN_ORDER);
        return List.copyOf(sorted);
    }

    public static Map<String, List<CcMapping>> groupCcBySection(List<CcMapping> mappings, String defaultSection) {
        return groupBySection(mappings, CcMapping::section, defaultSection);
    }

    public static Map<String, List<NrpnMapping>> groupNrpnBySection(List<NrpnMapping> mappings, String defaultSection) {
        return groupBySection(mappings, NrpnMapping::section, defaultSection);
    }

    /**
     * Groups entries by section in first-seen order, keeping entry order inside
     * each group. A null or empty section falls back to {@code defaultSection}.
     */
    public static <T> Map<String, List<T>> groupBySection(
        List<T> entries,
        Function<T, String> sectionOf,
        String defaultSection
    ) {
        Map<String, List<T>> grouped = new LinkedHashMap<>();
        for (T entry : entries) {
            String section = sectionOf.apply(entry);
            if (section == null || section.isEmpty()) {
                section = defaultSection;
            }
            grouped.computeIfAbsent(section, key -> new ArrayList<>()).add(entry);
        }
        return grouped;
    }
}
