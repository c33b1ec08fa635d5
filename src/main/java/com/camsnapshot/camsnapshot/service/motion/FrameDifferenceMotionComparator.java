package com.camsnapshot.camsnapshot.service.motion;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_core.absdiff;
import static org.bytedeco.opencv.global.opencv_core.countNonZero;
import static org.bytedeco.opencv.global.opencv_imgcodecs.IMREAD_GRAYSCALE;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imdecode;
import static org.bytedeco.opencv.global.opencv_imgproc.GaussianBlur;
import static org.bytedeco.opencv.global.opencv_imgproc.THRESH_BINARY;
import static org.bytedeco.opencv.global.opencv_imgproc.threshold;

/**
 * Motion level as the percentage of pixels whose grayscale value changed by more
 * than {@link #PIXEL_THRESHOLD} between two JPEG snapshots (OpenCV via JavaCV).
 */
@Component
public class FrameDifferenceMotionComparator implements MotionLevelComparator {

    private static final Logger log = LoggerFactory.getLogger(FrameDifferenceMotionComparator.class);

    private static final double PIXEL_THRESHOLD = 25.0;
    private static final Size BLUR_KERNEL = new Size(5, 5);

    @Override
    public Optional<Double> compare(String cameraExid, byte[] current, byte[] previous) {
        if (current == null || previous == null) {
            return Optional.empty();
        }

        Mat first = null;
        Mat second = null;
        Mat diff = new Mat();
        try {
            first = decode(current);
            second = decode(previous);
            if (first.empty() || second.empty()
                    || first.rows() != second.rows() || first.cols() != second.cols()) {
                return Optional.empty();
            }

            // Blur first so sensor noise and JPEG artefacts do not count as motion
            GaussianBlur(first, first, BLUR_KERNEL, 0);
            GaussianBlur(second, second, BLUR_KERNEL, 0);
            absdiff(first, second, diff);
            threshold(diff, diff, PIXEL_THRESHOLD, 255, THRESH_BINARY);

            long totalPixels = (long) diff.rows() * diff.cols();
            return Optional.of(countNonZero(diff) * 100.0 / totalPixels);
        } catch (RuntimeException e) {
            log.warn("[{}] [motion_level] comparison failed: {}", cameraExid, e.getMessage());
            return Optional.empty();
        } finally {
            // Mats hold native memory
            if (first != null) first.close();
            if (second != null) second.close();
            diff.close();
        }
    }

    private static Mat decode(byte[] jpeg) {
        try (BytePointer pointer = new BytePointer(jpeg); Mat buffer = new Mat(1, jpeg.length, CV_8UC1, pointer)) {
            return imdecode(buffer, IMREAD_GRAYSCALE);
        }
    }
}
