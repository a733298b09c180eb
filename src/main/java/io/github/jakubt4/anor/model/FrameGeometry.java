package io.github.jakubt4.anor.model;

/**
 * World-coordinate metadata needed to re-derive a frame's coordinate system.
 *
 * <p>All fields are nullable; {@code null} means the header did not carry the value.
 *
 * @param scaleX             plate scale along the x axis, arcsec per pixel ({@code CDELT1})
 * @param scaleY             plate scale along the y axis, arcsec per pixel ({@code CDELT2})
 * @param referenceX         reference pixel x, FITS 1-based ({@code CRPIX1})
 * @param referenceY         reference pixel y, FITS 1-based ({@code CRPIX2})
 * @param rotationDeg        image rotation relative to solar north, degrees ({@code CROTA2})
 * @param solarRadiusArcsec  apparent solar radius, arcsec ({@code RSUN_OBS})
 */
public record FrameGeometry(Double scaleX, Double scaleY,
                            Double referenceX, Double referenceY,
                            Double rotationDeg, Double solarRadiusArcsec) {

    public static FrameGeometry unknown() {
        return new FrameGeometry(null, null, null, null, null, null);
    }

    public boolean hasPlateScale() {
        return scaleX != null && scaleY != null && scaleX != 0.0 && scaleY != 0.0;
    }

    public boolean hasReferencePixel() {
        return referenceX != null && referenceY != null;
    }

    public double rotationOrZero() {
        return rotationDeg == null ? 0.0 : rotationDeg;
    }

    public FrameGeometry withReferencePixel(final double x, final double y) {
        return new FrameGeometry(scaleX, scaleY, x, y, rotationDeg, solarRadiusArcsec);
    }

    public FrameGeometry registered(final double scale) {
        return new FrameGeometry(scale, scale, referenceX, referenceY, 0.0, solarRadiusArcsec);
    }
}
