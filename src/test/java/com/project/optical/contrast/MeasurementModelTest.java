package com.project.optical.contrast;

import com.project.optical.contrast.DTOs.BackgroundColor;
import com.project.optical.contrast.DTOs.ChannelProfile;
import com.project.optical.contrast.DTOs.ContrastProfile;
import com.project.optical.contrast.DTOs.Measurement;
import com.project.optical.contrast.DTOs.Point;
import com.project.optical.contrast.DTOs.PolygonRegion;
import com.project.optical.contrast.DTOs.RgbImage;
import com.project.optical.contrast.DTOs.SampleChain;
import com.project.optical.contrast.DTOs.Segment;
import com.project.optical.contrast.exceptions.ContrastException;
import com.project.optical.contrast.exceptions.InsufficientPointsException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MeasurementModelTest {

    @Test
    void polygon_needs_three_points() {
        assertThatThrownBy(() -> PolygonRegion.of(Point.of(0, 0), Point.of(1, 1)))
                .isInstanceOf(InsufficientPointsException.class)
                .isInstanceOf(ContrastException.class)
                .hasMessageContaining("received: 2");
        assertThatThrownBy(() -> new PolygonRegion(null)).isInstanceOf(InsufficientPointsException.class);
    }

    @Test
    void rectangle_runs_clockwise_from_the_first_corner() {
        PolygonRegion rect = PolygonRegion.rectangle(Point.of(2, 3), Point.of(7, 9));

        assertThat(rect.points()).containsExactly(
                Point.of(2, 3), Point.of(7, 3), Point.of(7, 9), Point.of(2, 9));
    }

    @Test
    void polyline_becomes_consecutive_segments() {
        SampleChain chain = SampleChain.fromPolyline(List.of(Point.of(0, 0), Point.of(5, 0), Point.of(5, 5)));

        assertThat(chain.segments()).containsExactly(Segment.of(0, 0, 5, 0), Segment.of(5, 0, 5, 5));
        assertThatThrownBy(() -> SampleChain.fromPolyline(List.of(Point.of(1, 1))))
                .isInstanceOf(InsufficientPointsException.class);
        assertThatThrownBy(() -> new SampleChain(List.of())).isInstanceOf(InsufficientPointsException.class);
    }

    @Test
    void profiles_require_equal_channel_lengths() {
        assertThatThrownBy(() -> new ContrastProfile(new double[2], new double[2], new double[3]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ChannelProfile(new double[1], new double[0], new double[1]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void profiles_compare_by_content() {
        ContrastProfile a = new ContrastProfile(new double[]{0.5, -0.25}, new double[]{0, 1}, new double[]{2, 3});
        ContrastProfile b = new ContrastProfile(new double[]{0.5, -0.25}, new double[]{0, 1}, new double[]{2, 3});
        Measurement first = new Measurement("Linecut 1", SampleChain.of(Segment.of(0, 0, 1, 0)), 3, a);
        Measurement second = new Measurement("Linecut 1", SampleChain.of(Segment.of(0, 0, 1, 0)), 3, b);

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(a).isNotEqualTo(new ContrastProfile(new double[]{0.5, -0.5}, new double[]{0, 1}, new double[]{2, 3}));
        assertThat(new ChannelProfile(new double[]{1}, new double[]{2}, new double[]{3}))
                .isEqualTo(new ChannelProfile(new double[]{1}, new double[]{2}, new double[]{3}));
    }

    @Test
    void profiles_copy_their_arrays_in_and_out() {
        double[] red = {10, 20};
        ChannelProfile profile = new ChannelProfile(red, new double[]{0, 0}, new double[]{0, 0});
        red[0] = -1;
        profile.red()[1] = -1;

        assertThat(profile.red()).containsExactly(10, 20);
    }

    @Test
    void concat_keeps_order() {
        ChannelProfile a = new ChannelProfile(new double[]{1, 2}, new double[]{3, 4}, new double[]{5, 6});
        ChannelProfile b = new ChannelProfile(new double[]{7}, new double[]{8}, new double[]{9});

        ChannelProfile joined = ChannelProfile.concat(List.of(a, ChannelProfile.EMPTY, b));

        assertThat(joined.red()).containsExactly(1, 2, 7);
        assertThat(joined.green()).containsExactly(3, 4, 8);
        assertThat(joined.blue()).containsExactly(5, 6, 9);
    }

    @Test
    void background_channels_must_be_bytes() {
        assertThatThrownBy(() -> new BackgroundColor(256, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackgroundColor(0, -1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void packed_image_is_copied() {
        int[] pixels = {0x102030, 0x405060};
        RgbImage image = RgbImage.of(2, 1, pixels);
        pixels[0] = 0;

        assertThat(image.red(0, 0)).isEqualTo(0x10);
        assertThat(image.blue(1, 0)).isEqualTo(0x60);
        assertThat(image.contains(2, 0)).isFalse();
        assertThatThrownBy(() -> RgbImage.of(2, 2, pixels)).isInstanceOf(IllegalArgumentException.class);
    }
}
