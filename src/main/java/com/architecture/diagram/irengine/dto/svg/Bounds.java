package com.architecture.diagram.irengine.dto.svg;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.List;

/**
 * Axis-aligned bounding box in SVG user units.
 */
@Value(staticConstructor = "of")
public class Bounds {

    public static final Bounds EMPTY = Bounds.of(0, 0, 0, 0);

    double x;
    double y;
    double width;
    double height;

    public static Bounds enclosing(List<Point> points) {
        if (points.isEmpty()) {
            return EMPTY;
        }
        double minX = Double.MAX_VALUE, minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE, maxY = -Double.MAX_VALUE;
        for (Point p : points) {
            minX = Math.min(minX, p.getX());
            minY = Math.min(minY, p.getY());
            maxX = Math.max(maxX, p.getX());
            maxY = Math.max(maxY, p.getY());
        }
        return Bounds.of(minX, minY, maxX - minX, maxY - minY);
    }

    @JsonIgnore
    public Point getCenter() {
        return Point.of(x + width / 2, y + height / 2);
    }

    @JsonIgnore
    public double getArea() {
        return width * height;
    }

    @JsonIgnore
    public boolean hasPositiveArea() {
        return width > 0 && height > 0;
    }

    public boolean contains(Point p) {
        return p.getX() >= x && p.getX() <= x + width
                && p.getY() >= y && p.getY() <= y + height;
    }
}
