package io.github.yok.eqelc.core.spectrum;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.eqelc.core.error.GridMismatchException;
import io.github.yok.eqelc.core.error.ValidationException;
import org.junit.jupiter.api.Test;

class PhotonFluxSpectrumTest {

    @Test
    void evaluatesFluxWithLinearInterpolation() {
        PhotonFluxSpectrum s = PhotonFluxSpectrum.custom("ramp", new double[] {400.0, 600.0},
                new double[] {1e17, 3e17});

        assertThat(s.fluxAt(500.0)).isCloseTo(2e17, within(1e3));
        assertThat(s.fluxAt(400.0)).isEqualTo(1e17);
    }

    @Test
    void fluxOutsideRangeIsRejected() {
        PhotonFluxSpectrum s = PhotonFluxSpectrum.custom("flat", new double[] {400.0, 600.0},
                new double[] {1e17, 1e17});

        assertThatThrownBy(() -> s.fluxAt(300.0)).isInstanceOf(GridMismatchException.class);
    }

    @Test
    void negativeFluxIsInvalid() {
        assertThatThrownBy(() -> PhotonFluxSpectrum.custom("bad", new double[] {400.0, 600.0},
                new double[] {1e17, -1.0})).isInstanceOf(ValidationException.class);
    }

    @Test
    void blankNameFallsBackToKindDefault() {
        PhotonFluxSpectrum s = PhotonFluxSpectrum.of(SpectrumKind.GLOBAL, "",
                new double[] {400.0, 600.0}, new double[] {1e17, 1e17});

        assertThat(s.getName()).isEqualTo(SpectrumKind.GLOBAL.getDefaultName());
        assertThat(s.getKind()).isEqualTo(SpectrumKind.GLOBAL);
    }

    @Test
    void irradianceIsConvertedToPhotonFlux() {
        // 1 W/m2/nm at 500 nm: E·λ/(h·c)
        PhotonFluxSpectrum s = PhotonFluxSpectrum.fromSpectralIrradiance(SpectrumKind.DIRECT,
                null, new double[] {500.0, 1000.0}, new double[] {1.0, 1.0});

        double expected500 =
                500e-9 / (PhotonFluxSpectrum.PLANCK * PhotonFluxSpectrum.SPEED_OF_LIGHT);
        assertThat(s.fluxAt(500.0)).isCloseTo(expected500, within(expected500 * 1e-12));
        assertThat(s.fluxAt(1000.0)).isCloseTo(2 * expected500, within(expected500 * 1e-12));
        assertThat(expected500).isCloseTo(2.517e18, within(1e15));
    }

    @Test
    void irradianceConversionRejectsInvalidWavelengthsFirst() {
        assertThatThrownBy(() -> PhotonFluxSpectrum.fromSpectralIrradiance(SpectrumKind.GLOBAL,
                null, new double[] {400.0, Double.NaN}, new double[] {1.0, 1.0}))
                .isInstanceOf(ValidationException.class).hasMessageContaining("波長に有限でない値");
        assertThatThrownBy(() -> PhotonFluxSpectrum.fromSpectralIrradiance(SpectrumKind.GLOBAL,
                null, new double[] {-100.0, 400.0}, new double[] {1.0, 1.0}))
                .isInstanceOf(ValidationException.class).hasMessageContaining("波長は正の値");
        assertThatThrownBy(() -> PhotonFluxSpectrum.fromSpectralIrradiance(SpectrumKind.GLOBAL,
                null, new double[] {400.0, 500.0}, new double[] {1.0}))
                .isInstanceOf(ValidationException.class).hasMessageContaining("個数");
    }

    @Test
    void sampledOnOtherGridUsesInterpolation() {
        PhotonFluxSpectrum s = PhotonFluxSpectrum.custom("ramp", new double[] {300.0, 700.0},
                new double[] {0.0, 4e17});

        double[] sampled = s.sampledOn(SpectralGrid.of(400.0, 500.0, 600.0));

        assertThat(sampled).containsExactly(new double[] {1e17, 2e17, 3e17}, within(1e3));
    }

    @Test
    void fluxAccessorReturnsCopy() {
        PhotonFluxSpectrum s = PhotonFluxSpectrum.custom("flat", new double[] {400.0, 600.0},
                new double[] {1e17, 1e17});

        s.getFlux()[0] = 0.0;

        assertThat(s.fluxAt(400.0)).isEqualTo(1e17);
    }
}
