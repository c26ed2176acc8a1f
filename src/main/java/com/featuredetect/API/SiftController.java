package com.featuredetect.API;

import com.featuredetect.SIFT.ImageFeature;
import com.featuredetect.SIFT.Keypoint;
import com.featuredetect.SIFT.UnpackedOctave;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*") // Cho phép gọi từ file HTML bất kỳ
public class SiftController {

    private static final Logger LOG = LoggerFactory.getLogger(SiftController.class);

    private final SiftService siftService;

    @Autowired
    public SiftController(SiftService siftService) {
        this.siftService = siftService;
    }

    @PostMapping(value = "/sift", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> detectFeatures(
            @RequestParam("image") MultipartFile image,
            @RequestParam(value = "maxFeatures", required = false) Integer maxFeatures) {
        try {
            if (!siftService.isValidImageFile(image)) {
                return badRequest("File không hợp lệ: " + image.getOriginalFilename());
            }
            if (maxFeatures != null && maxFeatures < 0) {
                return badRequest("Tham số maxFeatures không được âm.");
            }

            double[][] gray;
            try {
                gray = siftService.decodeGray(image);
            } catch (IOException e) {
                LOG.warn("detectFeatures: cannot decode {}", image.getOriginalFilename(), e);
                return badRequest("Không đọc được ảnh: " + image.getOriginalFilename());
            }

            ImageFeature features = siftService.detect(gray, maxFeatures);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("width", gray.length == 0 ? 0 : gray[0].length);
            response.put("height", gray.length);
            response.put("numKeypoints", features.getNumKeypoints());
            response.put("keypoints", toJson(features.getKeyPoints()));
            response.put("descriptors", features.getDescriptors());
            return ResponseEntity.ok().body(response);

        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        } catch (Exception e) {
            LOG.error("detectFeatures: failed for {}", image.getOriginalFilename(), e);
            Map<String, String> error = new HashMap<>();
            error.put("error", "Lỗi: " + e.getMessage());
            return ResponseEntity.internalServerError().body(error);
        }
    }

    private static List<Map<String, Object>> toJson(List<Keypoint> keypoints) {
        List<Map<String, Object>> result = new ArrayList<>(keypoints.size());
        for (Keypoint keypoint : keypoints) {
            UnpackedOctave unpacked = keypoint.unpackOctave();
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("x", keypoint.getX());
            json.put("y", keypoint.getY());
            json.put("size", keypoint.getSize());
            json.put("angle", keypoint.getAngle());
            json.put("response", keypoint.getResponse());
            json.put("octave", unpacked.getOctave());
            json.put("layer", unpacked.getLayer());
            result.add(json);
        }
        return result;
    }

    private static ResponseEntity<Map<String, String>> badRequest(String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        return ResponseEntity.badRequest().body(error);
    }
}
