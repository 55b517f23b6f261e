package com.designgrowth.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A rung of the career ladder with what is expected of it per competency key.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CareerLevel {
    private String level; // Junior, Mid, Senior, Staff, Principal
    private Map<String, String> expectations;
}
