package com.camsnapshot.camsnapshot.service.motion;

import java.util.Optional;

/**
 * Scores how much two consecutive snapshots of a camera differ.
 */
public interface MotionLevelComparator {

    /**
     * @return the motion level, or empty when the images cannot be compared
     */
    Optional<Double> compare(String cameraExid, byte[] current, byte[] previous);
}
