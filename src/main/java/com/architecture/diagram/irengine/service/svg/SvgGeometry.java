package com.architecture.diagram.irengine.service.svg;

import com.architecture.diagram.irengine.dto.svg.Bounds;
import com.architecture.diagram.irengine.dto.svg.Point;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Geometry helpers for SVG shape primitives. Coordinates are in the element's own user space;
 * ancestor {@code translate(..)} offsets are applied by the caller.
 */
public final class SvgGeometry {

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*([-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?)(\\S*)");
    private static final Pattern NUMBER = Pattern.compile("[-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?");
    private static final Pattern PATH_TOKEN = Pattern.compile("[MmLlHhVvCcSsQqTtAaZz]|[-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?");
    private static final Pattern TRANSLATE = Pattern.compile("translate\\(\\s*([^,\\s)]+)(?:[,\\s]+([^,\\s)]+))?\\s*\\)");

    private SvgGeometry() {
    }

    /**
     * Parses a length such as {@code "120"}, {@code "120px"} or {@code "1.5e2"}.
     * Percentages and unparsable values yield {@code fallback}.
     */
    public static double length(String raw, double fallback) {
        if (raw == null) {
            return fallback;
        }
        Matcher m = LEADING_NUMBER.matcher(raw);
        if (!m.find() || "%".equals(m.group(2))) {
            return fallback;
        }
        return Double.parseDouble(m.group(1));
    }

    public static double number(String raw) {
        return length(raw, 0.0);
    }

    public static Bounds shapeBounds(SvgElement element) {
        String tag = element.getLocalName().toLowerCase(Locale.ROOT);
        switch (tag) {
            case "rect":
            case "image":
            case "foreignobject":
            case "use":
                return Bounds.of(number(element.attr("x")), number(element.attr("y")),
                        Math.max(0, number(element.attr("width"))), Math.max(0, number(element.attr("height"))));
            case "circle":
                double r = Math.max(0, number(element.attr("r")));
                return Bounds.of(number(element.attr("cx")) - r, number(element.attr("cy")) - r, 2 * r, 2 * r);
            case "ellipse":
                double rx = Math.max(0, number(element.attr("rx")));
                double ry = Math.max(0, number(element.attr("ry")));
                return Bounds.of(number(element.attr("cx")) - rx, number(element.attr("cy")) - ry, 2 * rx, 2 * ry);
            case "text":
                return Bounds.of(number(element.attr("x")), number(element.attr("y")), 0, 0);
            default:
                return Bounds.enclosing(points(element));
        }
    }

    /**
     * Vertices of a line, polyline, polygon or path. Path curves contribute their end points only.
     */
    public static List<Point> points(SvgElement element) {
        String tag = element.getLocalName().toLowerCase(Locale.ROOT);
        switch (tag) {
            case "line":
                return List.of(
                        Point.of(number(element.attr("x1")), number(element.attr("y1"))),
                        Point.of(number(element.attr("x2")), number(element.attr("y2"))));
            case "polyline":
            case "polygon":
                return pointList(element.attr("points"));
            case "path":
                return pathPoints(element.attr("d"));
            default:
                return List.of();
        }
    }

    public static Point translateOffset(String transform) {
        if (transform == null) {
            return Point.of(0, 0);
        }
        Matcher m = TRANSLATE.matcher(transform);
        if (!m.find()) {
            return Point.of(0, 0);
        }
        double tx = number(m.group(1));
        double ty = m.group(2) != null ? number(m.group(2)) : 0.0;
        return Point.of(tx, ty);
    }

    public static Bounds offset(Bounds b, Point by) {
        return Bounds.of(b.getX() + by.getX(), b.getY() + by.getY(), b.getWidth(), b.getHeight());
    }

    public static List<Point> offset(List<Point> points, Point by) {
        List<Point> shifted = new ArrayList<>(points.size());
        for (Point p : points) {
            shifted.add(Point.of(p.getX() + by.getX(), p.getY() + by.getY()));
        }
        return shifted;
    }

    private static List<Point> pointList(String raw) {
        List<Point> points = new ArrayList<>();
        if (raw == null) {
            return points;
        }
        List<Double> numbers = new ArrayList<>();
        Matcher m = NUMBER.matcher(raw);
        while (m.find()) {
            numbers.add(Double.parseDouble(m.group()));
        }
        for (int i = 0; i + 1 < numbers.size(); i += 2) {
            points.add(Point.of(numbers.get(i), numbers.get(i + 1)));
        }
        return points;
    }

    private static List<Point> pathPoints(String d) {
        List<Point> points = new ArrayList<>();
        if (d == null) {
            return points;
        }
        List<String> tokens = new ArrayList<>();
        Matcher m = PATH_TOKEN.matcher(d);
        while (m.find()) {
            tokens.add(m.group());
        }

        char command = 'M';
        double cx = 0, cy = 0, startX = 0, startY = 0;
        int i = 0;
        while (i < tokens.size()) {
            String token = tokens.get(i);
            if (Character.isLetter(token.charAt(0))) {
                command = token.charAt(0);
                i++;
                if (command == 'Z' || command == 'z') {
                    cx = startX;
                    cy = startY;
                }
                continue;
            }
            int arity = arity(command);
            if (arity == 0 || i + arity > tokens.size()) {
                break;
            }
            double[] args = new double[arity];
            for (int k = 0; k < arity; k++) {
                String t = tokens.get(i + k);
                if (Character.isLetter(t.charAt(0))) {
                    return points;
                }
                args[k] = Double.parseDouble(t);
            }
            i += arity;

            boolean relative = Character.isLowerCase(command);
            double nx = cx, ny = cy;
            switch (Character.toUpperCase(command)) {
                case 'H':
                    nx = relative ? cx + args[0] : args[0];
                    break;
                case 'V':
                    ny = relative ? cy + args[0] : args[0];
                    break;
                default:
                    nx = relative ? cx + args[arity - 2] : args[arity - 2];
                    ny = relative ? cy + args[arity - 1] : args[arity - 1];
            }
            cx = nx;
            cy = ny;
            points.add(Point.of(cx, cy));
            if (command == 'M' || command == 'm') {
                startX = cx;
                startY = cy;
                // subsequent pairs after a moveto are implicit linetos
                command = command == 'M' ? 'L' : 'l';
            }
        }
        return points;
    }

    private static int arity(char command) {
        switch (Character.toUpperCase(command)) {
            case 'M':
            case 'L':
            case 'T':
                return 2;
            case 'H':
            case 'V':
                return 1;
            case 'S':
            case 'Q':
                return 4;
            case 'C':
                return 6;
            case 'A':
                return 7;
            default:
                return 0;
        }
    }
}
