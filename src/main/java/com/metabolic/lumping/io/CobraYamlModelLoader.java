package com.metabolic.lumping.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public class CobraYamlModelLoader extends CobraModelLoader {

    public CobraYamlModelLoader() {
        super(new ObjectMapper(new YAMLFactory()));
    }
}
