package com.camsnapshot.camsnapshot.service.motion;

import org.junit.jupiter.api.*;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FrameDifferenceMotionComparatorTest {

    private FrameDifferenceMotionComparator comparator;

    @BeforeEach
    void setUp() {
        comparator = new FrameDifferenceMotionComparator();
    }

    @Test
    void testIdenticalFramesHaveNoMotion() throws Exception {
        byte[] frame = jpeg(64, 64, false);

        Optional<Double> level = comparator.compare("cam1", frame, frame);

        assertTrue(level.isPresent());
        assertTrue(level.get() < 1.0, "expected no motion, got " + level.get());
    }

    @Test
    void testChangedQuarterIsAboutTwentyFivePercent() throws Exception {
        Optional<Double> level = comparator.compare("cam1", jpeg(64, 64, true), jpeg(64, 64, false));

        assertTrue(level.isPresent());
        assertTrue(level.get() > 20.0 && level.get() < 35.0, "unexpected motion level " + level.get());
    }

    @Test
    void testDifferentSizesAreNotCompared() throws Exception {
        assertTrue(comparator.compare("cam1", jpeg(64, 64, false), jpeg(32, 32, false)).isEmpty());
    }

    @Test
    void testUndecodableInput() throws Exception {
        assertTrue(comparator.compare("cam1", new byte[] {1, 2, 3}, jpeg(64, 64, false)).isEmpty());
        assertTrue(comparator.compare("cam1", null, jpeg(64, 64, false)).isEmpty());
    }

    private static byte[] jpeg(int width, int height, boolean whiteQuarter) throws Exception {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.BLACK);
        g.fillRect(0, 0, width, height);
        if (whiteQuarter) {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width / 2, height / 2);
        }
        g.dispose();

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "jpg", out);
        return out.toByteArray();
    }
}
