package com.example.slides.controller.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Where to write the slides and, optionally, which of them. {@code selected}
 * holds indices into the job's retained slides; null exports all of them.
 */
public class ExportRequest {

    @NotBlank
    private String destination;

    private List<Integer> selected;

    public ExportRequest() {
    }

    public ExportRequest(String destination, List<Integer> selected) {
        this.destination = destination;
        this.selected = selected;
    }

    public String getDestination() { return destination; }
    public void setDestination(String destination) { this.destination = destination; }

    public List<Integer> getSelected() { return selected; }
    public void setSelected(List<Integer> selected) { this.selected = selected; }
}
