package com.gnovoa.livematch.positions;

/** Maps a pitch coordinate (percent of length and width) to a position code. */
public interface PositionClassifier {

    /** Code used when no zone covers the coordinate. */
    String FALLBACK_CODE = "SUB";

    String classify(double x, double y);
}
