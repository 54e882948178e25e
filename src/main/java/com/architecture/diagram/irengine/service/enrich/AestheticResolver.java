package com.architecture.diagram.irengine.service.enrich;

import com.architecture.diagram.irengine.dto.enrich.Contrast;
import com.architecture.diagram.irengine.dto.enrich.Density;
import com.architecture.diagram.irengine.dto.enrich.Mood;
import com.architecture.diagram.irengine.dto.plan.AestheticIntent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns optional aesthetic intent into a palette and closed-enum global settings.
 * Bad taste input never fails: unrecognised values fall back to defaults.
 */
@Component
@Slf4j
public class AestheticResolver {

    public static final List<String> DEFAULT_PALETTE = List.of(
            "#FDE68A", "#FBCFE8", "#E0E7FF", "#DB2777", "#0F172A");
    public static final String FONT_FAMILY = "Inter, Arial, sans-serif";

    private static final int MIN_PALETTE = 2;
    private static final int MAX_PALETTE = 8;

    private static final Pattern LONG_HEX = Pattern.compile("^#[0-9a-fA-F]{6}$");
    private static final Pattern SHORT_HEX = Pattern.compile("^#[0-9a-fA-F]{3}$");
    private static final Pattern RGB = Pattern.compile(
            "^rgb\\(\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*\\)$", Pattern.CASE_INSENSITIVE);

    /**
     * Palette of 2 to 8 uppercase {@code #RRGGBB} colours. User colours come first; the default
     * palette pads anything shorter than two.
     */
    public List<String> resolvePalette(AestheticIntent intent) {
        List<String> palette = new ArrayList<>();
        for (Object raw : userPalette(intent)) {
            String color = normalizeColor(raw);
            if (color != null) {
                palette.add(color);
            } else {
                log.debug("Ignoring unparseable palette entry: {}", raw);
            }
        }
        if (palette.size() < MIN_PALETTE) {
            for (String fallback : DEFAULT_PALETTE) {
                if (!palette.contains(fallback)) {
                    palette.add(fallback);
                }
            }
        }
        if (palette.size() > MAX_PALETTE) {
            palette = new ArrayList<>(palette.subList(0, MAX_PALETTE));
        }
        return List.copyOf(palette);
    }

    public Mood resolveMood(AestheticIntent intent) {
        Mood mood = Mood.fromString(globalSetting(intent, "mood"));
        return mood != null ? mood : Mood.MINIMAL;
    }

    public Contrast resolveContrast(AestheticIntent intent) {
        Contrast contrast = Contrast.fromString(globalSetting(intent, "contrast"));
        return contrast != null ? contrast : Contrast.NORMAL;
    }

    /**
     * Explicit density when recognised, else derived from how crowded the diagram is.
     */
    public Density resolveDensity(AestheticIntent intent, int nodeCount) {
        Density density = Density.fromString(globalSetting(intent, "density"));
        if (density != null) {
            return density;
        }
        if (nodeCount >= 10) {
            return Density.COMPACT;
        }
        return nodeCount <= 3 ? Density.SPACIOUS : Density.BALANCED;
    }

    /**
     * Normalise {@code #abc}, {@code #aabbcc} or {@code rgb(r,g,b)} to {@code #RRGGBB}.
     * Returns null for anything else.
     */
    public static String normalizeColor(Object value) {
        if (!(value instanceof String)) {
            return null;
        }
        String token = ((String) value).trim();
        if (token.isEmpty()) {
            return null;
        }
        if (LONG_HEX.matcher(token).matches()) {
            return token.toUpperCase(Locale.ROOT);
        }
        if (SHORT_HEX.matcher(token).matches()) {
            StringBuilder expanded = new StringBuilder("#");
            for (char ch : token.substring(1).toCharArray()) {
                expanded.append(ch).append(ch);
            }
            return expanded.toString().toUpperCase(Locale.ROOT);
        }
        Matcher rgb = RGB.matcher(token);
        if (rgb.matches()) {
            return String.format(Locale.ROOT, "#%02X%02X%02X",
                    channel(rgb.group(1)), channel(rgb.group(2)), channel(rgb.group(3)));
        }
        return null;
    }

    private static int channel(String digits) {
        return Math.max(0, Math.min(255, Integer.parseInt(digits)));
    }

    private Collection<?> userPalette(AestheticIntent intent) {
        if (intent == null) {
            return List.of();
        }
        if (intent.getMetadata() != null) {
            Object nested = intent.getMetadata().get("userPalette");
            if (nested instanceof Collection) {
                return (Collection<?>) nested;
            }
            if (nested instanceof String) {
                return List.of(nested);
            }
        }
        return intent.getUserPalette() != null ? intent.getUserPalette() : List.of();
    }

    private String globalSetting(AestheticIntent intent, String key) {
        if (intent == null || intent.getGlobalIntent() == null) {
            return null;
        }
        return intent.getGlobalIntent().get(key);
    }
}
