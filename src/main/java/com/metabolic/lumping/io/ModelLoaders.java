package com.metabolic.lumping.io;

import com.metabolic.lumping.domain.MetabolicModel;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Picks the model loader from the file extension.
 */
@Slf4j
public final class ModelLoaders {

    private ModelLoaders() {
    }

    /**
     * @throws ModelLoadException if no loader handles the extension
     */
    public static ModelLoader forPath(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".json")) {
            return new CobraJsonModelLoader();
        }
        if (fileName.endsWith(".yml") || fileName.endsWith(".yaml")) {
            return new CobraYamlModelLoader();
        }
        if (fileName.endsWith(".xml") || fileName.endsWith(".sbml")) {
            return new SbmlModelLoader();
        }
        if (fileName.endsWith(".mat")) {
            return new CobraMatModelLoader();
        }
        throw new ModelLoadException("Unrecognized model file extension: " + path);
    }

    /**
     * Loads a model, turning every failure into a {@link ModelLoadException}.
     */
    public static MetabolicModel load(Path path) {
        if (!Files.isReadable(path)) {
            throw new ModelLoadException("Model file not found or not readable: " + path);
        }
        ModelLoader loader = forPath(path);
        try {
            MetabolicModel model = loader.load(path);
            log.info("Loaded model {} from {}: {} reactions, {} metabolites", model.getId(), path,
                    model.getReactionCount(), model.getMetaboliteCount());
            return model;
        } catch (ModelLoadException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new ModelLoadException("Could not load model from " + path + ": " + e.getMessage(), e);
        } catch (LinkageError e) {
            // A reader library missing one of its runtime classes
            throw new ModelLoadException("Model reader for " + path + " is unavailable: " + e, e);
        }
    }
}
