package com.project.optical.contrast;

import com.project.optical.contrast.DTOs.BackgroundColor;
import com.project.optical.contrast.DTOs.Measurement;
import com.project.optical.contrast.DTOs.Point;
import com.project.optical.contrast.DTOs.PolygonRegion;
import com.project.optical.contrast.DTOs.RgbImage;
import com.project.optical.contrast.DTOs.SampleChain;
import com.project.optical.contrast.DTOs.Segment;
import com.project.optical.contrast.exceptions.ContrastException;
import com.project.optical.contrast.service.ContrastMeasurementService;
import com.project.optical.contrast.service.MeasurementSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MeasurementSessionTest {
    private static final PolygonRegion LEFT_HALF = PolygonRegion.rectangle(Point.of(0, 0), Point.of(4, 9));
    private static final PolygonRegion RIGHT_HALF = PolygonRegion.rectangle(Point.of(5, 0), Point.of(9, 9));
    private static final SampleChain ACROSS = SampleChain.of(Segment.of(0, 5, 9, 5));

    private MeasurementSession session;

    // left half gray 100, right half gray 200
    private static RgbImage twoHalves() {
        BufferedImage img = new BufferedImage(10, 10, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(new Color(100, 100, 100)); g.fillRect(0, 0, 5, 10);
        g.setColor(new Color(200, 200, 200)); g.fillRect(5, 0, 5, 10);
        g.dispose();
        return RgbImage.from(img);
    }

    @BeforeEach
    void setup() {
        session = new ContrastMeasurementService().openSession(twoHalves());
    }

    @Test
    void line_cut_requires_a_background() {
        assertThat(session.background()).isEmpty();
        assertThatThrownBy(() -> session.addLineCut(ACROSS))
                .isInstanceOf(ContrastException.class)
                .hasMessageContaining("background");
    }

    @Test
    void measurements_are_named_in_order_with_default_width() {
        assertThat(session.defineBackground(LEFT_HALF)).isEqualTo(new BackgroundColor(100, 100, 100));

        Measurement first = session.addLineCut(ACROSS);
        Measurement second = session.addLineCut(SampleChain.of(Segment.of(0, 2, 9, 2)), 1);

        assertThat(first.name()).isEqualTo("Linecut 1");
        assertThat(first.width()).isEqualTo(10);
        assertThat(second.name()).isEqualTo("Linecut 2");
        assertThat(session.measurements()).extracting(Measurement::name).containsExactly("Linecut 1", "Linecut 2");
    }

    @Test
    void removing_renumbers_the_rest() {
        session.defineBackground(LEFT_HALF);
        session.addLineCut(ACROSS, 1);
        session.addLineCut(ACROSS, 3);
        session.addLineCut(ACROSS, 5);

        Measurement removed = session.remove(0);

        assertThat(removed.width()).isEqualTo(1);
        assertThat(session.measurements()).extracting(Measurement::name).containsExactly("Linecut 1", "Linecut 2");
        assertThat(session.measurements()).extracting(Measurement::width).containsExactly(3, 5);
    }

    @Test
    void new_background_recomputes_existing_measurements() {
        session.defineBackground(LEFT_HALF);
        session.addLineCut(ACROSS, 1);
        // against 100: [0 x5, 1 x5], bright plateau shifted to 0
        assertThat(session.measurements().get(0).profile().red()).containsExactly(-1, -1, -1, -1, -1, 0, 0, 0, 0, 0);

        session.defineBackground(RIGHT_HALF);

        assertThat(session.background()).contains(new BackgroundColor(200, 200, 200));
        assertThat(session.backgroundRegion()).contains(RIGHT_HALF);
        assertThat(session.measurements().get(0).profile().red())
                .containsExactly(-0.5, -0.5, -0.5, -0.5, -0.5, 0, 0, 0, 0, 0);
        assertThat(session.measurements().get(0).name()).isEqualTo("Linecut 1");
    }

    @Test
    void width_change_recomputes_one_measurement() {
        session.defineBackground(LEFT_HALF);
        session.addLineCut(SampleChain.of(Segment.of(2, 0, 2, 9)), 1);

        Measurement updated = session.changeWidth(0, 5);

        assertThat(updated.width()).isEqualTo(5);
        assertThat(updated.name()).isEqualTo("Linecut 1");
        assertThat(session.measurements().get(0)).isSameAs(updated);
        // columns 0..4 are all background, so the band stays flat
        assertThat(updated.profile().red()).containsOnly(0.0);
    }

    @Test
    void invalid_width_and_index_are_rejected() {
        session.defineBackground(LEFT_HALF);
        session.addLineCut(ACROSS, 1);

        assertThatThrownBy(() -> session.addLineCut(ACROSS, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> session.changeWidth(0, 1000)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> session.changeWidth(3, 5)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> session.remove(-1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void measurement_list_is_a_snapshot() {
        session.defineBackground(LEFT_HALF);
        session.addLineCut(ACROSS, 1);

        assertThatThrownBy(() -> session.measurements().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThat(session.measurements()).hasSize(1);
    }

    @Test
    void failed_recompute_keeps_the_previous_background_and_measurements() {
        ContrastMeasurementService failsOnSecondCut = new ContrastMeasurementService() {
            @Override
            public Measurement measure(String name, RgbImage image, SampleChain chain,
                                       BackgroundColor background, int width) {
                if (background.red() == 200 && name.equals("Linecut 2")) {
                    throw new ContrastException("recompute failed");
                }
                return super.measure(name, image, chain, background, width);
            }
        };
        MeasurementSession failing = failsOnSecondCut.openSession(twoHalves());
        failing.defineBackground(LEFT_HALF);
        failing.addLineCut(ACROSS, 1);
        failing.addLineCut(ACROSS, 3);
        List<Measurement> before = failing.measurements();

        assertThatThrownBy(() -> failing.defineBackground(RIGHT_HALF))
                .isInstanceOf(ContrastException.class)
                .hasMessage("recompute failed");

        assertThat(failing.background()).contains(new BackgroundColor(100, 100, 100));
        assertThat(failing.backgroundRegion()).contains(LEFT_HALF);
        assertThat(failing.measurements()).isEqualTo(before);
        assertThat(failing.measurements().get(0).profile().red())
                .containsExactly(-1, -1, -1, -1, -1, 0, 0, 0, 0, 0);
    }

    @Test
    void profile_arrays_handed_out_do_not_change_the_session() {
        session.defineBackground(LEFT_HALF);
        session.addLineCut(ACROSS, 1);

        session.measurements().get(0).profile().red()[0] = 42.0;

        assertThat(session.measurements().get(0).profile().red()[0]).isEqualTo(-1.0);
    }
}
