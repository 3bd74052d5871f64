package at.sv.sky.time;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ObservingNightTest {

    private static final ZoneId CHICAGO = ZoneId.of("America/Chicago");

    @Mock
    private SunTimesProvider sunTimesProvider;

    private static ZonedDateTime time(int month, int day, int hour, int minute) {
        return ZonedDateTime.of(2024, month, day, hour, minute, 0, 0, CHICAGO);
    }

    @Test
    void visibilityScan_beforeEvening_startsAtSix() {
        ObservingNight night = ObservingNight.visibilityScan(time(1, 15, 12, 0));

        assertThat(night.start()).isEqualTo(time(1, 15, 18, 0));
        assertThat(night.end()).isEqualTo(time(1, 16, 6, 0));
        assertThat(night.length()).isEqualTo(Duration.ofHours(12));
    }

    @Test
    void visibilityScan_afterEvening_startsNow() {
        ObservingNight night = ObservingNight.visibilityScan(time(1, 15, 21, 7));

        assertThat(night.start()).isEqualTo(time(1, 15, 21, 7));
        assertThat(night.end()).isEqualTo(time(1, 16, 6, 0));
    }

    @Test
    void visibilityScan_afterMidnight_scansTheComingEvening() {
        ObservingNight night = ObservingNight.visibilityScan(time(1, 16, 1, 0));

        assertThat(night.start()).isEqualTo(time(1, 16, 18, 0));
        assertThat(night.end()).isEqualTo(time(1, 17, 6, 0));
    }

    @Test
    void visibilityScan_daylightSavingStart_isAnHourShorter() {
        ObservingNight night = ObservingNight.visibilityScan(time(3, 9, 10, 0));

        assertThat(night.length()).isEqualTo(Duration.ofHours(11));
    }

    @Test
    void chart_eveningToEightInTheMorning() {
        ObservingNight night = ObservingNight.chart(time(1, 15, 21, 30));

        assertThat(night.start()).isEqualTo(time(1, 15, 18, 0));
        assertThat(night.end()).isEqualTo(time(1, 16, 8, 0));
        assertThat(night.length()).isEqualTo(Duration.ofHours(14));
    }

    @Test
    void contains_halfOpen() {
        ObservingNight night = ObservingNight.visibilityScan(time(1, 15, 12, 0));

        assertThat(night.contains(time(1, 15, 18, 0))).isTrue();
        assertThat(night.contains(time(1, 16, 5, 59))).isTrue();
        assertThat(night.contains(time(1, 16, 6, 0))).isFalse();
        assertThat(night.contains(time(1, 15, 17, 59))).isFalse();
    }

    @Test
    void sunsetToSunrise() {
        ZonedDateTime now = time(1, 15, 12, 0);
        when(sunTimesProvider.getSunset(now)).thenReturn(time(1, 15, 16, 53));
        when(sunTimesProvider.getNextSunrise(now)).thenReturn(time(1, 16, 7, 17));

        ObservingNight night = ObservingNight.sunsetToSunrise(now, sunTimesProvider);

        assertThat(night.start()).isEqualTo(time(1, 15, 16, 53));
        assertThat(night.end()).isEqualTo(time(1, 16, 7, 17));
    }

    @Test
    void sunsetToSunrise_polarDay_null() {
        ZonedDateTime now = time(6, 21, 12, 0);
        when(sunTimesProvider.getSunset(now)).thenReturn(null);
        when(sunTimesProvider.getNextSunrise(now)).thenReturn(null);

        assertThat(ObservingNight.sunsetToSunrise(now, sunTimesProvider)).isNull();
    }
}
