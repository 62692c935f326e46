/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.illumination.terrain;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Inverse polar stereographic projection on a sphere.
 *
 * <p>Supports the polar aspect only ({@code +lat_0=90} or {@code +lat_0=-90}),
 * which is what lunar polar DEM products use. Formulas follow Snyder,
 * <i>Map Projections: A Working Manual</i>, eq. 21-15 and 20-16, where for
 * the polar aspect the latitude reduces to {@code +-(c - 90 deg)} with
 * {@code c = 2 atan(rho / (2 R k0))}.</p>
 */
public final class PolarStereographicReprojection implements Reprojection {

    /** Mean lunar radius (meters). */
    public static final double MOON_RADIUS_M = 1_737_400.0;

    /** Projection used by the lunar south pole products. */
    public static final String LUNAR_SOUTH_POLE_PROJ =
            "+proj=stere +lat_0=-90 +lon_0=0 +k=1 +x_0=0 +y_0=0 +R=1737400 +units=m +no_defs";

    private final boolean southPole;
    private final double centralMeridianDeg;
    private final double scale;
    private final double falseEasting;
    private final double falseNorthing;
    private final double radius;

    public PolarStereographicReprojection(
            boolean southPole,
            double centralMeridianDeg,
            double scale,
            double falseEasting,
            double falseNorthing,
            double radius) {
        if (!(radius > 0.0) || !(scale > 0.0)) {
            throw new IllegalArgumentException("Radius and scale must be positive");
        }
        this.southPole = southPole;
        this.centralMeridianDeg = centralMeridianDeg;
        this.scale = scale;
        this.falseEasting = falseEasting;
        this.falseNorthing = falseNorthing;
        this.radius = radius;
    }

    /**
     * Build from a PROJ definition string such as {@link #LUNAR_SOUTH_POLE_PROJ}.
     * Missing parameters take PROJ defaults; a missing radius takes the lunar one.
     *
     * @throws IllegalArgumentException if the definition is not a polar stereographic sphere
     */
    public static PolarStereographicReprojection fromProj(String definition) {
        Map<String, String> params = parseProj(definition);
        if (!"stere".equals(params.get("proj"))) {
            throw new IllegalArgumentException("Not a stereographic projection: " + definition);
        }
        double lat0 = number(params, "lat_0", 90.0);
        if (Math.abs(Math.abs(lat0) - 90.0) > 1e-9) {
            throw new IllegalArgumentException("Only the polar aspect is supported, got lat_0=" + lat0);
        }
        return new PolarStereographicReprojection(
                lat0 < 0,
                number(params, "lon_0", 0.0),
                number(params, "k", number(params, "k_0", 1.0)),
                number(params, "x_0", 0.0),
                number(params, "y_0", 0.0),
                number(params, "R", MOON_RADIUS_M));
    }

    @Override
    public GeographicPoints toGeographic(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y differ in length: " + x.length + " vs " + y.length);
        }
        double[] lons = new double[x.length];
        double[] lats = new double[x.length];
        double twoRk = 2.0 * radius * scale;
        for (int i = 0; i < x.length; i++) {
            double dx = x[i] - falseEasting;
            double dy = y[i] - falseNorthing;
            double rho = Math.hypot(dx, dy);
            if (rho == 0.0) {
                lats[i] = southPole ? -90.0 : 90.0;
                lons[i] = normalizeLongitude(centralMeridianDeg);
                continue;
            }
            double c = 2.0 * Math.atan(rho / twoRk);
            // c is the angular distance from the pole
            double lat;
            double lon;
            if (southPole) {
                lat = c - Math.PI / 2;
                lon = Math.atan2(dx, dy);
            } else {
                lat = Math.PI / 2 - c;
                lon = Math.atan2(dx, -dy);
            }
            lats[i] = Math.toDegrees(lat);
            lons[i] = normalizeLongitude(centralMeridianDeg + Math.toDegrees(lon));
        }
        return new GeographicPoints(lons, lats);
    }

    public boolean isSouthPole() {
        return southPole;
    }

    public double radius() {
        return radius;
    }

    static double normalizeLongitude(double lonDeg) {
        double l = lonDeg % 360.0;
        if (l > 180.0) l -= 360.0;
        else if (l <= -180.0) l += 360.0;
        return l;
    }

    private static Map<String, String> parseProj(String definition) {
        Map<String, String> params = new HashMap<>();
        for (String token : definition.trim().split("\\s+")) {
            if (!token.startsWith("+")) continue;
            int eq = token.indexOf('=');
            if (eq < 0) {
                params.put(token.substring(1), "");
            } else {
                params.put(token.substring(1, eq), token.substring(eq + 1).toLowerCase(Locale.ROOT));
            }
        }
        return params;
    }

    private static double number(Map<String, String> params, String key, double fallback) {
        String value = params.get(key);
        if (value == null || value.isEmpty()) return fallback;
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad PROJ parameter +" + key + "=" + value, e);
        }
    }
}
