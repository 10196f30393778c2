package org.lsst.fits.logscale.cmap;

/**
 * Maps 8 bit display levels to packed 0xRRGGBB colors.
 */
public abstract class RGBColorMap {

    private final String name;
    private final int size;

    protected RGBColorMap(String name, int size) {
        if (size < 2) {
            throw new IllegalArgumentException("Color map needs at least two entries: " + size);
        }
        this.name = name;
        this.size = size;
    }

    public abstract int getRGB(int level);

    public String getName() {
        return name;
    }

    public int getSize() {
        return size;
    }

    /**
     * @return The packed color for every level, indexed by level
     */
    public int[] toLookupTable() {
        int[] table = new int[size];
        for (int i = 0; i < size; i++) {
            table[i] = getRGB(i);
        }
        return table;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + "name=" + name + ", size=" + size + '}';
    }
}
