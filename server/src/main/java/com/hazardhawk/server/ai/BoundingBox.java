package com.hazardhawk.server.ai;

/**
 * Normalized image region, all values in [0, 1] relative to the image size.
 */
public class BoundingBox {
    private final float left;
    private final float top;
    private final float width;
    private final float height;

    public BoundingBox(float left, float top, float width, float height) {
        this.left = left;
        this.top = top;
        this.width = width;
        this.height = height;
    }

    public float getLeft() {
        return left;
    }

    public float getTop() {
        return top;
    }

    public float getWidth() {
        return width;
    }

    public float getHeight() {
        return height;
    }

    public float getRight() {
        return left + width;
    }

    public float getBottom() {
        return top + height;
    }

    @Override
    public String toString() {
        return String.format("BoundingBox{left=%.3f, top=%.3f, width=%.3f, height=%.3f}", left, top, width, height);
    }
}
