package com.metabolic.lumping.io;

import com.metabolic.lumping.domain.MetabolicModel;
import com.metabolic.lumping.domain.Metabolite;
import com.metabolic.lumping.domain.Reaction;
import lombok.extern.slf4j.Slf4j;
import org.sbml.jsbml.CVTerm;
import org.sbml.jsbml.Model;
import org.sbml.jsbml.Parameter;
import org.sbml.jsbml.SBMLDocument;
import org.sbml.jsbml.SBMLReader;
import org.sbml.jsbml.Species;
import org.sbml.jsbml.SpeciesReference;
import org.sbml.jsbml.ext.fbc.FBCConstants;
import org.sbml.jsbml.ext.fbc.FBCReactionPlugin;
import org.sbml.jsbml.xml.XMLNode;

import javax.xml.stream.XMLStreamException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads SBML models as written by cobra: {@code M_}/{@code R_} id prefixes, flux
 * bounds from the fbc package and the subsystem in the reaction notes.
 */
@Slf4j
public class SbmlModelLoader implements ModelLoader {

    private static final Pattern SUBSYSTEM = Pattern.compile("SUBSYSTEM:\\s*(.+)");
    private static final String SEED_RESOURCE = "seed.compound/";

    @Override
    public MetabolicModel load(Path path) throws IOException {
        SBMLDocument document;
        try {
            document = SBMLReader.read(path.toFile());
        } catch (XMLStreamException e) {
            throw new ModelLoadException("Invalid SBML in " + path + ": " + e.getMessage(), e);
        }
        Model sbmlModel = document.getModel();
        if (sbmlModel == null) {
            throw new ModelLoadException("SBML file " + path + " contains no model");
        }
        String modelId = sbmlModel.isSetId() ? sbmlModel.getId()
                : path.getFileName().toString().replaceFirst("\\.[^.]+$", "");
        MetabolicModel model = new MetabolicModel(modelId);

        for (Species species : sbmlModel.getListOfSpecies()) {
            model.addMetabolite(Metabolite.builder()
                    .id(stripPrefix(species.getId(), "M_"))
                    .name(species.getName())
                    .compartment(species.getCompartment())
                    .seedId(seedId(species))
                    .boundary(species.getBoundaryCondition())
                    .build());
        }

        int missingBounds = 0;
        for (org.sbml.jsbml.Reaction sbmlReaction : sbmlModel.getListOfReactions()) {
            double defaultLower = sbmlReaction.getReversible() ? -Reaction.DEFAULT_BOUND : 0.0;
            Reaction.ReactionBuilder reaction = Reaction.builder()
                    .id(stripPrefix(sbmlReaction.getId(), "R_"))
                    .name(sbmlReaction.getName())
                    .subsystem(subsystem(sbmlReaction.getNotes()));

            // Flux bounds are parameters referenced from the fbc plugin
            FBCReactionPlugin fbc = (FBCReactionPlugin) sbmlReaction.getExtension(FBCConstants.shortLabel);
            Double lower = fbc == null ? null : boundValue(sbmlModel, fbc.getLowerFluxBound());
            Double upper = fbc == null ? null : boundValue(sbmlModel, fbc.getUpperFluxBound());
            if (lower == null || upper == null) {
                missingBounds++;
            }
            reaction.lowerBound(lower == null ? defaultLower : lower);
            reaction.upperBound(upper == null ? Reaction.DEFAULT_BOUND : upper);

            for (SpeciesReference reactant : sbmlReaction.getListOfReactants()) {
                reaction.metabolite(stripPrefix(reactant.getSpecies(), "M_"), -coefficient(reactant));
            }
            for (SpeciesReference product : sbmlReaction.getListOfProducts()) {
                reaction.metabolite(stripPrefix(product.getSpecies(), "M_"), coefficient(product));
            }
            model.addReaction(reaction.build());
        }
        if (missingBounds > 0) {
            log.warn("{} reactions in {} have no fbc flux bounds; defaults applied.", missingBounds, path);
        }
        return model;
    }

    private static String stripPrefix(String id, String prefix) {
        return id.startsWith(prefix) ? id.substring(prefix.length()) : id;
    }

    private static double coefficient(SpeciesReference reference) {
        return reference.isSetStoichiometry() ? reference.getStoichiometry() : 1.0;
    }

    private static Double boundValue(Model sbmlModel, String parameterId) {
        if (parameterId == null || parameterId.isEmpty()) {
            return null;
        }
        Parameter parameter = sbmlModel.getParameter(parameterId);
        return parameter == null ? null : parameter.getValue();
    }

    private static String seedId(Species species) {
        for (CVTerm term : species.getCVTerms()) {
            for (String resource : term.getResources()) {
                int pos = resource.indexOf(SEED_RESOURCE);
                if (pos >= 0) {
                    return resource.substring(pos + SEED_RESOURCE.length());
                }
            }
        }
        return null;
    }

    /**
     * Searches the text of the notes for a {@code SUBSYSTEM: name} paragraph.
     */
    private static String subsystem(XMLNode notes) {
        if (notes == null) {
            return "";
        }
        if (notes.isText()) {
            Matcher m = SUBSYSTEM.matcher(notes.getCharacters());
            if (m.find()) {
                return m.group(1).trim();
            }
            return "";
        }
        for (int i = 0; i < notes.getChildCount(); i++) {
            String found = subsystem(notes.getChildAt(i));
            if (!found.isEmpty()) {
                return found;
            }
        }
        return "";
    }
}
