package com.featuredetect.API;

import com.featuredetect.SIFT.ImageFeature;
import com.featuredetect.SIFT.SIFTFeatureDetector;
import com.featuredetect.SIFT.SiftParameters;
import com.featuredetect.imageOperator.ColourImageToGray;
import com.featuredetect.imageOperator.ImageOperators;
import com.featuredetect.imageOperator.JavaImageOperators;
import com.featuredetect.imageOperator.OpenCvImageOperators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@Service
public class SiftService {

    private static final Logger LOG = LoggerFactory.getLogger(SiftService.class);

    private final SiftParameters parameters;
    private final ImageOperators operators;
    private final SIFTFeatureDetector detector;

    /**
     * @throws com.featuredetect.SIFT.InvalidSiftParametersException if the configured parameters are out of range,
     *         so a misconfigured application fails at startup.
     */
    @Autowired
    public SiftService(SiftProperties properties) {
        this.parameters = properties.toParameters();
        this.operators = properties.getBackend() == SiftProperties.Backend.OPENCV
                         ? new OpenCvImageOperators()
                         : new JavaImageOperators();
        this.detector = new SIFTFeatureDetector(parameters, operators);
        LOG.info("SiftService: using {} backend with {}", properties.getBackend(), parameters);
    }

    /**
     * Kiểm tra xem file upload có phải ảnh không
     */
    public boolean isValidImageFile(MultipartFile file) {
        if (file == null || file.isEmpty()) return false;

        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            return false;
        }

        String originalFilename = file.getOriginalFilename();
        return originalFilename != null &&
                originalFilename.matches("(?i).+\\.(jpg|jpeg|png|gif|bmp|webp)$");
    }

    /**
     * Chuyển ảnh upload sang ma trận xám.
     *
     * @throws IOException if the bytes cannot be read or decoded.
     */
    public double[][] decodeGray(MultipartFile file) throws IOException {
        return ColourImageToGray.grayMatrix(file.getBytes());
    }

    /**
     * @param maxFeatures overrides the configured limit when not null.
     */
    public ImageFeature detect(double[][] gray, Integer maxFeatures) {
        if (maxFeatures == null || maxFeatures == parameters.getMaxFeatures()) {
            return detector.detectFeatures(gray);
        }
        SiftParameters limited = parameters.toBuilder().maxFeatures(maxFeatures).build();
        return new SIFTFeatureDetector(limited, operators).detectFeatures(gray);
    }
}
