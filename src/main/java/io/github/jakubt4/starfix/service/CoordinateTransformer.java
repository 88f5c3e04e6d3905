package io.github.jakubt4.starfix.service;

import io.github.jakubt4.starfix.dto.CelestialCoord;
import io.github.jakubt4.starfix.dto.ImageCoord;
import io.github.jakubt4.starfix.dto.RotationMatrix;
import io.github.jakubt4.starfix.dto.TransformRequest;
import io.github.jakubt4.starfix.dto.TransformResponse;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.linear.MatrixUtils;
import org.hipparchus.linear.RealMatrix;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Converts between image pixels and sky coordinates for a known orientation. Stateless; safe
 * to call from any number of threads at once.
 *
 * <p>Camera model: pinhole with the boresight along the camera +X axis, image columns running
 * along -Y and rows along -Z, horizontal field of view across the image width, and a single
 * radial distortion coefficient {@code k} applied about the image centre with radius normalized
 * to half the image width.
 */
@Slf4j
@Component
public class CoordinateTransformer {

    private static final double ORTHONORMAL_TOLERANCE = 1e-6;
    private static final double DISTORTION_TOLERANCE = 1e-9;
    private static final int DISTORTION_MAX_ITERATIONS = 30;

    /**
     * @throws IllegalArgumentException if the geometry is missing or the matrix is not a rotation
     */
    public TransformResponse transform(final TransformRequest request) {
        final var camera = Camera.of(request);
        final var rotation = rotationOf(request.rotationMatrix());

        final List<CelestialCoord> celestial = request.imageCoords().isEmpty()
                ? null
                : request.imageCoords().stream().map(coord -> toCelestial(coord, rotation, camera)).toList();
        final List<ImageCoord> image = request.celestialCoords().isEmpty()
                ? null
                : request.celestialCoords().stream().map(coord -> toImage(coord, rotation, camera)).toList();

        log.debug("[TRANSFORM] {} image -> sky, {} sky -> image",
                request.imageCoords().size(), request.celestialCoords().size());
        return new TransformResponse(celestial, image);
    }

    CelestialCoord toCelestial(final ImageCoord coord, final RealMatrix rotation, final Camera camera) {
        final var halfWidth = camera.width() / 2.0;
        final var halfHeight = camera.height() / 2.0;
        final var radial = camera.undistortionScale(coord.x() - halfWidth, coord.y() - halfHeight);
        final var column = halfWidth + (coord.x() - halfWidth) * radial;
        final var row = halfHeight + (coord.y() - halfHeight) * radial;

        final var cameraVector = new Vector3D(1.0,
                (halfWidth - column) * camera.scale(),
                (halfHeight - row) * camera.scale()).normalize();
        final var sky = new Vector3D(rotation.operate(cameraVector.toArray()));

        var ra = FastMath.toDegrees(sky.getAlpha());
        if (ra < 0) {
            ra += 360.0;
        }
        if (ra >= 360.0) {
            ra -= 360.0;
        }
        return new CelestialCoord(ra, FastMath.toDegrees(sky.getDelta()));
    }

    ImageCoord toImage(final CelestialCoord coord, final RealMatrix rotation, final Camera camera) {
        final var sky = new Vector3D(FastMath.toRadians(coord.ra()), FastMath.toRadians(coord.dec()));
        final var cameraVector = new Vector3D(rotation.preMultiply(sky.toArray()));
        if (cameraVector.getX() <= 0) {
            return ImageCoord.unmapped();
        }

        final var halfWidth = camera.width() / 2.0;
        final var halfHeight = camera.height() / 2.0;
        final var dx = -cameraVector.getY() / (cameraVector.getX() * camera.scale());
        final var dy = -cameraVector.getZ() / (cameraVector.getX() * camera.scale());
        final var radial = camera.distortionScale(dx, dy);
        final var x = halfWidth + dx * radial;
        final var y = halfHeight + dy * radial;

        if (!(x > 0 && x < camera.width() && y > 0 && y < camera.height())) {
            return ImageCoord.unmapped();
        }
        return new ImageCoord(x, y);
    }

    static RealMatrix rotationOf(final RotationMatrix matrix) {
        if (matrix == null) {
            throw new IllegalArgumentException("Rotation matrix is required");
        }
        final var rotation = MatrixUtils.createRealMatrix(matrix.toArray());
        final var residual = rotation.multiply(rotation.transpose())
                .subtract(MatrixUtils.createRealIdentityMatrix(3))
                .getFrobeniusNorm();
        if (residual > ORTHONORMAL_TOLERANCE) {
            throw new IllegalArgumentException("Rotation matrix is not orthonormal (residual " + residual + ")");
        }
        return rotation;
    }

    /**
     * Image geometry. {@code scale} is the tangent-plane extent of one pixel.
     */
    record Camera(int width, int height, double scale, double k) {

        static Camera of(final TransformRequest request) {
            if (request.imageWidth() == null || request.imageHeight() == null
                    || request.imageWidth() <= 0 || request.imageHeight() <= 0) {
                throw new IllegalArgumentException("Image size must be positive, got width="
                        + request.imageWidth() + " height=" + request.imageHeight());
            }
            if (request.fov() == null || !(request.fov() > 0 && request.fov() < 180)) {
                throw new IllegalArgumentException("Field of view must be in (0, 180) degrees, got " + request.fov());
            }
            final var k = request.distortion() == null ? 0.0 : request.distortion();
            if (k >= 1.0) {
                throw new IllegalArgumentException("Distortion must be below 1, got " + k);
            }
            final var scale = FastMath.tan(FastMath.toRadians(request.fov()) / 2) / (request.imageWidth() / 2.0);
            return new Camera(request.imageWidth(), request.imageHeight(), scale, k);
        }

        /**
         * Factor taking an offset from the image centre in the distorted image to the undistorted one.
         */
        double undistortionScale(final double dx, final double dy) {
            final var r = FastMath.hypot(dx, dy) / (width / 2.0);
            return (1 - k * r * r) / (1 - k);
        }

        /**
         * Inverse of {@link #undistortionScale}, found by fixed-point iteration on the radius.
         */
        double distortionScale(final double dx, final double dy) {
            final var undistorted = FastMath.hypot(dx, dy) / (width / 2.0);
            if (k == 0.0 || undistorted == 0.0) {
                return 1.0;
            }
            var distorted = undistorted;
            for (var i = 0; i < DISTORTION_MAX_ITERATIONS; i++) {
                final var estimate = distorted * (1 - k * distorted * distorted) / (1 - k);
                final var error = estimate - undistorted;
                distorted -= error;
                if (FastMath.abs(error) < DISTORTION_TOLERANCE) {
                    break;
                }
            }
            return distorted / undistorted;
        }
    }
}
