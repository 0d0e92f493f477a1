/*
 * (c) Copyright the normalheston-lib authors. All rights reserved.
 *
 * Created on 19.10.2026
 */
package net.normalheston.exception;

/**
 * Thrown if the target strike of a Fourier pricer does not fall onto the strike grid spanned by
 * the grid size, the frequency spacing and the grid center.
 */
public class GridConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = -2204917631572740516L;

    private final int       gridSize;
    private final double    frequencySpacing;
    private final double    targetStrike;
    private final long      strikeIndex;

    public GridConfigurationException(int gridSize, double frequencySpacing, double targetStrike, long strikeIndex) {
        super("Strike index " + strikeIndex + " for target strike k_u=" + targetStrike + " is outside [0, " + gridSize + "). "
                + "Change the grid size M=" + gridSize + ", the frequency spacing eta=" + frequencySpacing
                + " or the target strike k_u=" + targetStrike + ".");
        this.gridSize = gridSize;
        this.frequencySpacing = frequencySpacing;
        this.targetStrike = targetStrike;
        this.strikeIndex = strikeIndex;
    }

    public int getGridSize() {
        return gridSize;
    }

    public double getFrequencySpacing() {
        return frequencySpacing;
    }

    public double getTargetStrike() {
        return targetStrike;
    }

    public long getStrikeIndex() {
        return strikeIndex;
    }
}
