package com.conveyal.gridmaps.aggregate;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A named subset of the active cells, such as a zone, for which a separate set of maps is produced. Filters are
 * independent of one another and may overlap. The special filter returned by all() includes every cell.
 */
public class InclusionFilter {

    public static final String ALL_NAME = "all";

    public final String name;

    /** One flag per active cell, true for included cells. Null means every cell is included. */
    private final boolean[] mask;

    private InclusionFilter (String name, boolean[] mask) {
        this.name = checkNotNull(name, "Filter name must not be null.");
        this.mask = mask;
    }

    public static InclusionFilter all () {
        return new InclusionFilter(ALL_NAME, null);
    }

    public static InclusionFilter all (String name) {
        return new InclusionFilter(name, null);
    }

    public static InclusionFilter of (String name, boolean[] mask) {
        checkNotNull(mask, "Filter mask must not be null, use InclusionFilter.all() to include every cell.");
        return new InclusionFilter(name, mask.clone());
    }

    public boolean includesAll () {
        return mask == null;
    }

    public boolean includes (int cell) {
        return mask == null || mask[cell];
    }

    /** True if no cell at all passes this filter. */
    public boolean excludesAll () {
        if (mask == null) return false;
        for (boolean m : mask) if (m) return false;
        return true;
    }

    /** Check that a mask filter has one flag per cell. Filters including everything fit any number of cells. */
    public void checkSize (int cellCount) {
        checkArgument(mask == null || mask.length == cellCount, "Filter %s has %s flags for %s active cells.",
                name, mask == null ? 0 : mask.length, cellCount);
    }

    /** The filter for only the given cells, in the order listed. */
    public InclusionFilter subset (int[] cells) {
        if (mask == null) return this;
        boolean[] subMask = new boolean[cells.length];
        for (int i = 0; i < cells.length; i++) {
            subMask[i] = mask[cells[i]];
        }
        return new InclusionFilter(name, subMask);
    }

    @Override
    public String toString () {
        return mask == null ? String.format("[filter %s, all cells]", name) : String.format("[filter %s]", name);
    }

}
