package com.metabolic.lumping.io;

import com.metabolic.lumping.domain.MetabolicModel;
import com.metabolic.lumping.domain.Metabolite;
import com.metabolic.lumping.domain.Reaction;
import us.hebi.matlab.mat.format.Mat5;
import us.hebi.matlab.mat.format.Mat5File;
import us.hebi.matlab.mat.types.Array;
import us.hebi.matlab.mat.types.Cell;
import us.hebi.matlab.mat.types.Char;
import us.hebi.matlab.mat.types.MatFile;
import us.hebi.matlab.mat.types.Matrix;
import us.hebi.matlab.mat.types.Struct;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a MATLAB v5 file holding a cobra model struct. The model is the first struct
 * variable in the file; its variable name becomes the model id.
 *
 * <p>Required fields are {@code rxns}, {@code mets} and the stoichiometric matrix
 * {@code S} (metabolites by reactions, dense or sparse). {@code lb}, {@code ub},
 * {@code subSystems}, {@code rxnNames}, {@code metNames} and {@code metSEEDID} are
 * read when present.</p>
 */
public class CobraMatModelLoader implements ModelLoader {

    @Override
    public MetabolicModel load(Path path) throws IOException {
        Mat5File mat = Mat5.readFromFile(path.toFile());
        String modelId = null;
        Struct struct = null;
        for (MatFile.Entry entry : mat.getEntries()) {
            if (entry.getValue() instanceof Struct) {
                modelId = entry.getName();
                struct = (Struct) entry.getValue();
                break;
            }
        }
        if (struct == null) {
            throw new ModelLoadException("MATLAB file " + path + " contains no model struct");
        }
        List<String> fields = struct.getFieldNames();
        for (String required : List.of("rxns", "mets", "S")) {
            if (!fields.contains(required)) {
                throw new ModelLoadException("Model struct in " + path + " has no " + required + " field");
            }
        }

        List<String> mets = strings(struct.get("mets"));
        List<String> rxns = strings(struct.get("rxns"));
        List<String> metNames = optionalStrings(struct, "metNames", mets.size());
        List<String> seedIds = optionalStrings(struct, "metSEEDID", mets.size());
        List<String> rxnNames = optionalStrings(struct, "rxnNames", rxns.size());
        List<String> subsystems = optionalStrings(struct, "subSystems", rxns.size());
        Matrix lb = null;
        Matrix ub = null;
        if (fields.contains("lb")) {
            lb = struct.get("lb");
        }
        if (fields.contains("ub")) {
            ub = struct.get("ub");
        }
        Matrix s = struct.get("S");
        if (s.getNumRows() != mets.size() || s.getNumCols() != rxns.size()) {
            throw new ModelLoadException("S in " + path + " is " + s.getNumRows() + "x" + s.getNumCols()
                    + " but the model has " + mets.size() + " metabolites and " + rxns.size() + " reactions");
        }

        MetabolicModel model = new MetabolicModel(modelId);
        for (int i = 0; i < mets.size(); i++) {
            model.addMetabolite(Metabolite.builder()
                    .id(mets.get(i))
                    .name(metNames.get(i))
                    .seedId(seedIds.get(i).isEmpty() ? null : seedIds.get(i))
                    .build());
        }
        for (int j = 0; j < rxns.size(); j++) {
            Reaction.ReactionBuilder reaction = Reaction.builder()
                    .id(rxns.get(j))
                    .name(rxnNames.get(j))
                    .subsystem(subsystems.get(j))
                    .lowerBound(lb == null ? -Reaction.DEFAULT_BOUND : lb.getDouble(j))
                    .upperBound(ub == null ? Reaction.DEFAULT_BOUND : ub.getDouble(j));
            for (int i = 0; i < mets.size(); i++) {
                double coef = s.getDouble(i, j);
                if (coef != 0.0) {
                    reaction.metabolite(mets.get(i), coef);
                }
            }
            model.addReaction(reaction.build());
        }
        return model;
    }

    private static List<String> optionalStrings(Struct struct, String field, int size) {
        List<String> result = struct.getFieldNames().contains(field) ? strings(struct.get(field)) : new ArrayList<>();
        while (result.size() < size) {
            result.add("");
        }
        return result;
    }

    private static List<String> strings(Array array) {
        List<String> result = new ArrayList<>();
        if (array instanceof Cell) {
            Cell cell = (Cell) array;
            for (int i = 0; i < cell.getNumElements(); i++) {
                result.add(text(cell.get(i)));
            }
        } else if (array instanceof Char) {
            result.add(((Char) array).getString());
        } else {
            throw new ModelLoadException("Expected a cell array of strings, found " + array.getClass().getSimpleName());
        }
        return result;
    }

    // Newer cobra toolboxes store each subsystem as a nested cell
    private static String text(Array element) {
        if (element instanceof Char) {
            return ((Char) element).getString().trim();
        }
        if (element instanceof Cell && element.getNumElements() > 0) {
            return text(((Cell) element).get(0));
        }
        return "";
    }
}
