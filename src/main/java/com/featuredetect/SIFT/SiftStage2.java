package com.featuredetect.SIFT;

import com.featuredetect.numeric.SymmetricMatrix3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Giai đoạn 2: tìm cực trị trong không gian DoG và định vị chính xác dưới mức pixel.
 * Candidates that diverge, do not converge, have low contrast or lie on an edge are dropped.
 */
public class SiftStage2 {

    private static final Logger LOG = LoggerFactory.getLogger(SiftStage2.class);

    private final double sigma;
    private final int numIntervals;
    private final int imageBorderWidth;
    private final double contrastThreshold;
    private final double eigenvalueRatio;
    private final int numAttemptsUntilConvergence;

    /** Ngưỡng tiền lọc trên giá trị DoG (thang 0-255), theo OpenCV. */
    private final double threshold;

    public SiftStage2(SiftParameters parameters) {
        this.sigma = parameters.getSigma();
        this.numIntervals = parameters.getNumIntervals();
        this.imageBorderWidth = parameters.getImageBorderWidth();
        this.contrastThreshold = parameters.getContrastThreshold();
        this.eigenvalueRatio = parameters.getEigenvalueRatio();
        this.numAttemptsUntilConvergence = parameters.getNumAttemptsUntilConvergence();
        this.threshold = Math.floor(0.5 * contrastThreshold / numIntervals * 255);
    }

    public List<LocalizedKeypoint> run(ScaleSpacePyramid pyramid) {
        List<LocalizedKeypoint> localized = new ArrayList<>();
        int candidateCount = 0;
        for (Octave octave : pyramid.getOctaves()) {
            List<KeypointCandidate> candidates = findCandidates(octave);
            candidateCount += candidates.size();
            for (KeypointCandidate candidate : candidates) {
                LocalizedKeypoint result = localizeExtremumViaQuadraticFit(candidate, octave);
                if (result != null) {
                    localized.add(result);
                }
            }
        }
        LOG.debug("run: localized {} of {} candidates", localized.size(), candidateCount);
        return localized;
    }

    /**
     * Quét cực trị 3x3x3 trên các ảnh DoG ở giữa octave, bỏ qua dải biên imageBorderWidth.
     */
    public List<KeypointCandidate> findCandidates(Octave octave) {
        List<KeypointCandidate> candidates = new ArrayList<>();
        List<SiftImage> dogImages = octave.getDogImages();

        for (int l = 1; l < dogImages.size() - 1; l++) {
            double[][] prev = dogImages.get(l - 1).data;
            double[][] current = dogImages.get(l).data;
            double[][] next = dogImages.get(l + 1).data;
            int height = current.length;
            int width = current[0].length;

            for (int r = imageBorderWidth; r < height - imageBorderWidth; r++) {
                for (int c = imageBorderWidth; c < width - imageBorderWidth; c++) {
                    if (isPixelAnExtremum(prev, current, next, r, c, threshold)) {
                        candidates.add(new KeypointCandidate(c, r, octave.getIndex(), l));
                    }
                }
            }
        }
        return candidates;
    }

    /**
     * Ties count: the centre only has to be greater than or equal to (less than or equal to) its 26 neighbours.
     */
    static boolean isPixelAnExtremum(double[][] prev, double[][] current, double[][] next, int r, int c, double threshold) {
        double pixelValue = current[r][c];
        if (Math.abs(pixelValue) <= threshold) {
            return false;
        }
        boolean isMax = pixelValue > 0;
        for (int dr = -1; dr <= 1; dr++) {
            for (int dc = -1; dc <= 1; dc++) {
                double below = prev[r + dr][c + dc];
                double above = next[r + dr][c + dc];
                double beside = current[r + dr][c + dc];
                if (isMax) {
                    if (pixelValue < below || pixelValue < above || pixelValue < beside) return false;
                } else {
                    if (pixelValue > below || pixelValue > above || pixelValue > beside) return false;
                }
            }
        }
        return true;
    }

    /**
     * Tinh chỉnh vị trí điểm ứng viên bằng cách khớp hàm bậc hai 3D (khai triển Taylor bậc 2).
     *
     * @return the refined keypoint, or null when the candidate is rejected.
     */
    public LocalizedKeypoint localizeExtremumViaQuadraticFit(KeypointCandidate candidate, Octave octave) {
        List<SiftImage> dogImages = octave.getDogImages();
        int height = octave.getHeight();
        int width = octave.getWidth();

        int r = candidate.getY();
        int c = candidate.getX();
        int imageIndex = candidate.getLayer();

        double[][][] pixelCube = null;
        double[] gradient = null;
        double[][] hessian = null;
        double[] extremumUpdate = null;
        boolean converged = false;

        for (int attempt = 0; attempt < numAttemptsUntilConvergence; attempt++) {
            pixelCube = extractPixelCube(dogImages, imageIndex, r, c);
            gradient = computeGradientAtCenterPixel(pixelCube);
            hessian = computeHessianAtCenterPixel(pixelCube);
            extremumUpdate = SymmetricMatrix3.solveLeastSquares(hessian, negate(gradient));

            if (Math.abs(extremumUpdate[0]) < 0.5 && Math.abs(extremumUpdate[1]) < 0.5 && Math.abs(extremumUpdate[2]) < 0.5) {
                converged = true;
                break;
            }
            c += (int) Math.rint(extremumUpdate[0]);
            r += (int) Math.rint(extremumUpdate[1]);
            imageIndex += (int) Math.rint(extremumUpdate[2]);

            if (r < imageBorderWidth || r >= height - imageBorderWidth ||
                c < imageBorderWidth || c >= width - imageBorderWidth ||
                imageIndex < 1 || imageIndex > numIntervals) {
                LOG.trace("localize: {} moved outside of the image before converging", candidate);
                return null;
            }
        }
        if (!converged) {
            LOG.trace("localize: {} did not converge in {} attempts", candidate, numAttemptsUntilConvergence);
            return null;
        }

        double functionValueAtUpdatedExtremum = pixelCube[1][1][1] + 0.5 * dot(gradient, extremumUpdate);
        if (Math.abs(functionValueAtUpdatedExtremum) * numIntervals < contrastThreshold) {
            LOG.trace("localize: {} has low contrast", candidate);
            return null;
        }
        if (isEdgeResponse(hessian)) {
            LOG.trace("localize: {} lies on an edge", candidate);
            return null;
        }

        int octaveIndex = octave.getIndex();
        double octaveScale = Math.scalb(1.0, octaveIndex);
        Keypoint keypoint = new Keypoint(
                (c + extremumUpdate[0]) * octaveScale,
                (r + extremumUpdate[1]) * octaveScale,
                // octaveIndex + 1 vì ảnh đầu vào đã được phóng to gấp đôi
                sigma * Math.pow(2.0, (imageIndex + extremumUpdate[2]) / numIntervals) * Math.scalb(1.0, octaveIndex + 1),
                Keypoint.UNSET_ANGLE,
                Math.abs(functionValueAtUpdatedExtremum),
                OctaveCode.pack(octaveIndex, imageIndex, extremumUpdate[2]));
        return new LocalizedKeypoint(keypoint, octaveIndex, imageIndex);
    }

    /**
     * Loại bỏ các phản hồi tại cạnh bằng ma trận Hessian 2D (x, y):
     * rejected when det <= 0 or ratio * trace^2 >= (ratio + 1)^2 * det.
     */
    boolean isEdgeResponse(double[][] hessian) {
        double dxx = hessian[0][0];
        double dyy = hessian[1][1];
        double dxy = hessian[0][1];
        double trace = dxx + dyy;
        double det = dxx * dyy - dxy * dxy;
        if (det <= 0) {
            return true;
        }
        return eigenvalueRatio * trace * trace >= (eigenvalueRatio + 1) * (eigenvalueRatio + 1) * det;
    }

    /**
     * Khối 3x3x3 quanh điểm, indexed [layer][row][col] and scaled to [0, 1].
     */
    static double[][][] extractPixelCube(List<SiftImage> dogImages, int imageIndex, int r, int c) {
        double[][][] cube = new double[3][3][3];
        for (int s = 0; s < 3; s++) {
            double[][] data = dogImages.get(imageIndex - 1 + s).data;
            for (int dr = 0; dr < 3; dr++) {
                for (int dc = 0; dc < 3; dc++) {
                    cube[s][dr][dc] = data[r - 1 + dr][c - 1 + dc] / 255.0;
                }
            }
        }
        return cube;
    }

    /**
     * Central differences with step 1, ordered (x, y, s).
     */
    static double[] computeGradientAtCenterPixel(double[][][] cube) {
        double dx = 0.5 * (cube[1][1][2] - cube[1][1][0]);
        double dy = 0.5 * (cube[1][2][1] - cube[1][0][1]);
        double ds = 0.5 * (cube[2][1][1] - cube[0][1][1]);
        return new double[] { dx, dy, ds };
    }

    /**
     * Second central differences, mixed terms from the 4-point stencil, ordered (x, y, s).
     */
    static double[][] computeHessianAtCenterPixel(double[][][] cube) {
        double v = cube[1][1][1];
        double dxx = cube[1][1][2] - 2 * v + cube[1][1][0];
        double dyy = cube[1][2][1] - 2 * v + cube[1][0][1];
        double dss = cube[2][1][1] - 2 * v + cube[0][1][1];
        double dxy = 0.25 * (cube[1][2][2] - cube[1][2][0] - cube[1][0][2] + cube[1][0][0]);
        double dxs = 0.25 * (cube[2][1][2] - cube[2][1][0] - cube[0][1][2] + cube[0][1][0]);
        double dys = 0.25 * (cube[2][2][1] - cube[2][0][1] - cube[0][2][1] + cube[0][0][1]);
        return new double[][] {
                { dxx, dxy, dxs },
                { dxy, dyy, dys },
                { dxs, dys, dss }
        };
    }

    private static double[] negate(double[] v) {
        return new double[] { -v[0], -v[1], -v[2] };
    }

    private static double dot(double[] a, double[] b) {
        return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
    }
}
