package com.metabolic.lumping.web;

import com.metabolic.lumping.domain.LumpingParams;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LumpingRequest {
    private String modelPath;    // .json, .yml or .xml
    private String thermoDbPath; // .thermodb or .json
    private List<String> biomassReactions;
    private List<String> coreSubsystems;
    private LumpingParams params;
}
