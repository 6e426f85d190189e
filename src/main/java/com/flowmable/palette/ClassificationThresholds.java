package com.flowmable.palette;

/**
 * Saturation/lightness gates and weights used for role assignment.
 *
 * @param vibrantMinSaturation    Vibrant requires saturation above this
 * @param vibrantMinLightness     Vibrant requires lightness above this
 * @param vibrantMaxLightness     Vibrant requires lightness below this
 * @param vibrantPopulationWeight Weight of the population ratio in the vibrant score
 * @param accentMinSaturation     Dark/light vibrant require saturation above this
 * @param darkMaxLightness        Dark vibrant requires lightness below this
 * @param lightMinLightness       Light vibrant requires lightness above this
 * @param mutedMaxSaturation      Muted requires saturation below this
 * @param mutedMinLightness       Muted requires lightness above this
 * @param mutedMaxLightness       Muted requires lightness below this
 */
public record ClassificationThresholds(
        double vibrantMinSaturation,
        double vibrantMinLightness,
        double vibrantMaxLightness,
        double vibrantPopulationWeight,
        double accentMinSaturation,
        double darkMaxLightness,
        double lightMinLightness,
        double mutedMaxSaturation,
        double mutedMinLightness,
        double mutedMaxLightness
) {
    public static final ClassificationThresholds DEFAULT = new ClassificationThresholds(
            0.3, // vibrantMinSaturation
            0.3, // vibrantMinLightness
            0.8, // vibrantMaxLightness
            0.5, // vibrantPopulationWeight
            0.2, // accentMinSaturation
            0.4, // darkMaxLightness
            0.7, // lightMinLightness
            0.3, // mutedMaxSaturation
            0.2, // mutedMinLightness
            0.8  // mutedMaxLightness
    );
}
