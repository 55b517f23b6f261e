package com.designgrowth.backend.service;

import com.designgrowth.backend.model.CareerLevel;
import com.designgrowth.backend.model.Competency;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static career framework returned by the reference and summary endpoints.
 * The lists and maps are unmodifiable, so every response serializes identically.
 */
public final class CareerFramework {

    private CareerFramework() {
        // Utility class — no instantiation
    }

    public static final List<Competency> COMPETENCIES = List.of(
            competency("product_strategy", "Product Strategy"),
            competency("craft_quality", "Craft Quality"),
            competency("collaboration", "Collaboration"),
            competency("impact", "Impact"),
            competency("mentorship", "Mentorship"));

    public static final List<CareerLevel> CAREER_LEVELS = List.of(
            level("Junior",
                    "craft_quality", "Executes with guidance",
                    "collaboration", "Communicates within team",
                    "impact", "Delivers assigned tasks"),
            level("Mid",
                    "product_strategy", "Contributes to product thinking",
                    "craft_quality", "Owns features end-to-end",
                    "collaboration", "Works cross-functionally",
                    "impact", "Improves team outcomes"),
            level("Senior",
                    "product_strategy", "Shapes problem spaces",
                    "craft_quality", "Raises quality bar",
                    "collaboration", "Aligns stakeholders",
                    "impact", "Leads complex initiatives",
                    "mentorship", "Coaches designers"),
            level("Staff",
                    "product_strategy", "Drives multi-team strategy",
                    "impact", "Org-level outcomes",
                    "mentorship", "Grows design org"),
            level("Principal",
                    "product_strategy", "Company-level strategy",
                    "impact", "Industry influence",
                    "mentorship", "Builds leaders"));

    public static final String DEFAULT_LEVEL = "Junior";

    private static Competency competency(String key, String title) {
        return Competency.builder().key(key).title(title).build();
    }

    // keyAndText alternates competency key and expectation text; insertion order is kept
    private static CareerLevel level(String level, String... keyAndText) {
        Map<String, String> expectations = new LinkedHashMap<>();
        for (int i = 0; i < keyAndText.length; i += 2) {
            expectations.put(keyAndText[i], keyAndText[i + 1]);
        }
        return CareerLevel.builder()
                .level(level)
                .expectations(Collections.unmodifiableMap(expectations))
                .build();
    }
}
