package com.jay.mfses.model;

import com.jay.mfses.model.enums.Horizon;

/** Horizon composites; each a weighted blend of {@link SubScores}, so always within [1, 20]. */
public record CompositeScores(double shortTerm, double midTerm, double longTerm) {

    public double get(Horizon horizon) {
        return switch (horizon) {
            case SHORT -> shortTerm;
            case MID   -> midTerm;
            case LONG  -> longTerm;
        };
    }
}
