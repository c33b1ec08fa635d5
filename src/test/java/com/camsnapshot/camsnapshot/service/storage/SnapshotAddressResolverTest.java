package com.camsnapshot.camsnapshot.service.storage;

import com.camsnapshot.camsnapshot.exception.InvalidTimestampException;
import com.camsnapshot.camsnapshot.model.SnapshotAddress;
import com.camsnapshot.camsnapshot.model.SourceTag;
import org.junit.jupiter.api.*;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotAddressResolverTest {

    private static final Instant TS = Instant.parse("2024-03-05T10:15:30.123456Z");

    private SnapshotAddressResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new SnapshotAddressResolver("/storage/");
    }

    @Test
    void testFilePath_RemoteRoot() {
        assertEquals("/cam1/snapshots/recordings/2024/03/05/10/15_30_123.jpg",
                resolver.filePath("cam1", TS, SourceTag.RECORDINGS, SnapshotAddressResolver.REMOTE_ROOT));
    }

    @Test
    void testDirectoryPath_LocalRootWithoutTrailingSlash() {
        assertEquals("/storage", resolver.getLocalRoot());
        assertEquals("/storage/cam1/snapshots/archives/2024/03/05/10/",
                resolver.directoryPath("cam1", TS, SourceTag.ARCHIVES));
    }

    @Test
    void testDirectoryPath_PadsSingleDigitComponents() {
        Instant early = Instant.parse("2001-01-02T03:04:05Z");
        assertEquals("/cam1/snapshots/timelapse/2001/01/02/03/",
                resolver.directoryPath("cam1", early, SourceTag.TIMELAPSE, SnapshotAddressResolver.REMOTE_ROOT));
        assertEquals("04_05_000.jpg", resolver.fileName(early));
    }

    @Test
    void testFileName_WholeSecondGetsZeroFraction() {
        assertEquals("15_30_000.jpg", resolver.fileName(Instant.parse("2024-03-05T10:15:30Z")));
    }

    @Test
    void testFileName_KeepsMillisecondsOnly() {
        assertEquals("15_30_001.jpg", resolver.fileName(Instant.parse("2024-03-05T10:15:30.001999Z")));
    }

    @Test
    void testFormatFileName_Rules() {
        assertEquals("15_30_000.jpg", SnapshotAddressResolver.formatFileName("15_30_"));
        assertEquals("15_30_123.jpg", SnapshotAddressResolver.formatFileName("15_30_123"));
        assertEquals("15_30_123.jpg", SnapshotAddressResolver.formatFileName("15_30_123456"));
        assertThrows(InvalidTimestampException.class, () -> SnapshotAddressResolver.formatFileName("15_30_1"));
        assertThrows(InvalidTimestampException.class, () -> SnapshotAddressResolver.formatFileName(null));
    }

    @Test
    void testResolve_Components() {
        SnapshotAddress address = resolver.resolve("cam1", TS, SourceTag.SNAPMAIL);

        assertEquals(2024, address.getYear());
        assertEquals(3, address.getMonth());
        assertEquals(5, address.getDay());
        assertEquals(10, address.getHour());
        assertEquals(15, address.getMinute());
        assertEquals(30, address.getSecond());
        assertEquals("123", address.getFraction());
        assertEquals(SourceTag.SNAPMAIL, address.getSourceTag());
    }

    @Test
    void testTimestampFromPath_RebuildsToTheSecond() {
        String path = resolver.directoryPath("cam1", TS, SourceTag.RECORDINGS, SnapshotAddressResolver.REMOTE_ROOT);

        assertEquals(Instant.parse("2024-03-05T10:15:30Z"),
                SnapshotAddressResolver.timestampFromPath(path, resolver.fileName(TS)));
    }

    @Test
    void testTimestampFromPath_RejectsGarbage() {
        assertThrows(InvalidTimestampException.class,
                () -> SnapshotAddressResolver.timestampFromPath("/cam1/snapshots/recordings/", "thumbnail.jpg"));
        assertThrows(InvalidTimestampException.class,
                () -> SnapshotAddressResolver.timestampFromPath("/a/2024/13/01/00/", "00_00_000.jpg"));
    }

    @Test
    void testSnapshotId_RoundTripsToTheMicrosecond() {
        String id = resolver.formatSnapshotId(12, TS);

        assertEquals("12_20240305101530123456", id);
        assertEquals(TS, SnapshotAddressResolver.timestampFromSnapshotId(id));
    }

    @Test
    void testSnapshotId_SecondPrecision() {
        assertEquals(Instant.parse("2024-03-05T10:15:30Z"),
                SnapshotAddressResolver.timestampFromSnapshotId("12_20240305101530"));
    }

    @Test
    void testSnapshotId_Malformed() {
        assertThrows(InvalidTimestampException.class, () -> SnapshotAddressResolver.timestampFromSnapshotId("12_2024"));
        assertThrows(InvalidTimestampException.class, () -> SnapshotAddressResolver.timestampFromSnapshotId("12_2024030510153x"));
        assertThrows(InvalidTimestampException.class, () -> SnapshotAddressResolver.timestampFromSnapshotId(null));
    }

    @Test
    void testOutOfRangeTimestampIsRejected() {
        assertThrows(InvalidTimestampException.class,
                () -> resolver.fileName(Instant.parse("1969-12-31T23:59:59Z")));
        assertThrows(InvalidTimestampException.class,
                () -> resolver.directoryPath("cam1", null, SourceTag.RECORDINGS));
    }
}
