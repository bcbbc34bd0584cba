package org.javai.fontfeatures.ir;

/**
 * An attachment point in font units.
 */
public record Anchor(int x, int y) {
}
