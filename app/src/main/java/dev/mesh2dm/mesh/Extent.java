package dev.mesh2dm.mesh;

/**
 * Horizontal bounding box of a mesh. All values are NaN for a mesh without nodes.
 */
public record Extent(double minX, double maxX, double minY, double maxY) {

    static final Extent EMPTY = new Extent(Double.NaN, Double.NaN, Double.NaN, Double.NaN);

    public boolean isEmpty() {
        return Double.isNaN(minX);
    }
}
