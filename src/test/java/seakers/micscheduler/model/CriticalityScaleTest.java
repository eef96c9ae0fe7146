package seakers.micscheduler.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class CriticalityScaleTest {

    @Test
    @DisplayName("RPN is divided by 100 and clamped to 1-10")
    void fromRpn() {
        assertEquals(10, CriticalityScale.fromRpn(10, 10, 10));
        assertEquals(3, CriticalityScale.fromRpn(8, 7, 6));
        assertEquals(1, CriticalityScale.fromRpn(5, 5, 4));
        assertEquals(1, CriticalityScale.fromRpn(1, 1, 1));
    }

    @Test
    @DisplayName("missing criticality defaults to the rounded project mean, or 5")
    void projectDefault() {
        assertEquals(5, CriticalityScale.projectDefault(Collections.emptyList()));
        assertEquals(4, CriticalityScale.projectDefault(Arrays.asList(2, 3, 4, 8)));
        assertEquals(9, CriticalityScale.projectDefault(Arrays.asList(9, 9, 10)));
    }

    @Test
    @DisplayName("negative RPN factors are rejected")
    void negativeFactor() {
        assertThrows(IllegalArgumentException.class, () -> CriticalityScale.fromRpn(-1, 5, 5));
    }
}
