package com.metabolic.lumping.io;

import com.metabolic.lumping.domain.MetabolicModel;

import java.io.IOException;
import java.nio.file.Path;

public interface ModelLoader {
    MetabolicModel load(Path path) throws IOException;
}
