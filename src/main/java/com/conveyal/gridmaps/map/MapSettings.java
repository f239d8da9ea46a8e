package com.conveyal.gridmaps.map;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loosely populated map settings as they arrive from surrounding tooling, where any field may be absent.
 * Converting to a MapSpecification validates them once: an explicit map needs every one of its fields, and in the
 * absence of any explicit field the map is derived from the grid using the pixel to cell ratio. A non-zero rotation
 * counts as an explicit field, so it is never dropped in favor of a derived map.
 */
public class MapSettings {

    public Double xori;
    public Double yori;
    public Double xinc;
    public Double yinc;
    public Integer ncol;
    public Integer nrow;
    public Double rotation;

    /** Used only when no explicit map is given. Null means DEFAULT_PIXEL_TO_CELL_RATIO. */
    public Double pixelToCellRatio;

    public MapSpecification toMapSpecification () {
        Map<String, Object> explicitFields = new LinkedHashMap<>();
        explicitFields.put("ncol", ncol);
        explicitFields.put("nrow", nrow);
        explicitFields.put("xinc", xinc);
        explicitFields.put("yinc", yinc);
        explicitFields.put("xori", xori);
        explicitFields.put("yori", yori);
        List<String> missing = new ArrayList<>();
        for (Map.Entry<String, Object> entry : explicitFields.entrySet()) {
            if (entry.getValue() == null) missing.add(entry.getKey());
        }
        boolean rotated = rotation != null && rotation != 0;
        if (missing.size() == explicitFields.size() && !rotated) {
            double ratio = pixelToCellRatio == null ? MapSpecification.DEFAULT_PIXEL_TO_CELL_RATIO : pixelToCellRatio;
            return MapSpecification.fromPixelToCellRatio(ratio);
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Failed to create map template due to partial map specification. " +
                    "Missing: " + String.join(", ", missing));
        }
        return MapSpecification.explicit(xori, yori, xinc, yinc, ncol, nrow, rotation == null ? 0 : rotation);
    }

}
