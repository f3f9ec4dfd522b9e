package com.example.astro.model;

import lombok.Value;

@Value
public class NutationAngles {
    double longitude; // Δψ (각초)
    double obliquity; // Δε (각초)
}
