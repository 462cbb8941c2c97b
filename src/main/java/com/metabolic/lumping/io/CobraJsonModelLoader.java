package com.metabolic.lumping.io;

import com.fasterxml.jackson.databind.ObjectMapper;

public class CobraJsonModelLoader extends CobraModelLoader {

    public CobraJsonModelLoader() {
        super(new ObjectMapper());
    }
}
