package com.architecture.diagram.irengine.dto.svg;

import lombok.Value;

@Value(staticConstructor = "of")
public class Point {
    double x;
    double y;

    public double distanceTo(Point other) {
        return Math.hypot(x - other.x, y - other.y);
    }
}
