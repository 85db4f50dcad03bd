package com.dcruver.themerank.ranking;

import com.dcruver.themerank.config.RankingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NoiseDetectorTest {

    private RankingProperties properties;
    private NoiseDetector detector;

    private static final double[][] TIGHT_GROUP_WITH_OUTLIER = {
        {1.0, 0.00}, {1.0, 0.05}, {1.0, 0.10}, {1.0, 0.15}, {1.0, 0.20}, {0.0, 1.0}
    };

    @BeforeEach
    void setUp() {
        properties = new RankingProperties();
        detector = new NoiseDetector(properties);
    }

    @Test
    void testEpsFallsBackToDefaultForSmallInputs() {
        double[][] rows = {{1.0, 0.0}, {0.0, 1.0}, {1.0, 1.0}};

        assertEquals(properties.getDefaultEps(), detector.estimateEps(rows, 5), 1e-12);
        assertEquals(properties.getDefaultEps(), detector.estimateEps(rows, 3), 1e-12);
    }

    @Test
    void testEpsIsClampedIntoUnitInterval() {
        double[][] identical = {{1.0, 0.0}, {1.0, 0.0}, {1.0, 0.0}, {1.0, 0.0}};

        double eps = detector.estimateEps(identical, 2);

        assertTrue(eps > 0.0);
        assertTrue(eps < 1.0);
    }

    @Test
    void testDbscanFlagsIsolatedPoint() {
        boolean[] outliers = detector.dbscanOutliers(TIGHT_GROUP_WITH_OUTLIER, 0.1);

        assertArrayEquals(new boolean[]{false, false, false, false, false, true}, outliers);
    }

    @Test
    void testDbscanKeepsEverythingWhenRadiusIsWide() {
        boolean[] outliers = detector.dbscanOutliers(TIGHT_GROUP_WITH_OUTLIER, 0.9999);

        for (boolean outlier : outliers) {
            assertFalse(outlier);
        }
    }

    @Test
    void testLofGivesOutlierLowestCleanliness() {
        double[] cleanliness = detector.lofCleanliness(TIGHT_GROUP_WITH_OUTLIER);

        assertEquals(0.0, cleanliness[5], 1e-9);
        for (int i = 0; i < 5; i++) {
            assertTrue(cleanliness[i] > cleanliness[5]);
            assertTrue(cleanliness[i] <= 10.0);
        }
    }

    @Test
    void testLofNeutralForTinyOrUniformInput() {
        assertArrayEquals(new double[]{5.0}, detector.lofCleanliness(new double[][]{{1.0, 0.0}}));

        double[] uniform = detector.lofCleanliness(new double[][]{{1.0, 0.0}, {1.0, 0.0}, {1.0, 0.0}});
        assertArrayEquals(new double[]{5.0, 5.0, 5.0}, uniform, 1e-12);
    }

    @Test
    void testBelowPercentile() {
        boolean[] flags = detector.belowPercentile(new double[]{10.0, 8.0, 9.0, 1.0, 7.0}, 20.0);

        assertArrayEquals(new boolean[]{false, false, false, true, false}, flags);
    }
}
