package com.astrazeneca.symetrics.data;

import com.astrazeneca.symetrics.exception.WrongVariantFormatException;

/**
 * Reference genome builds supported by the score tables. Positions are not comparable between builds
 * without liftover.
 */
public enum GenomeBuild {
    HG19("hg19", "GRCh37"),
    HG38("hg38", "GRCh38");

    private final String ucscName;
    private final String grcName;

    GenomeBuild(String ucscName, String grcName) {
        this.ucscName = ucscName;
        this.grcName = grcName;
    }

    public String getUcscName() {
        return ucscName;
    }

    /**
     * The other supported build: liftover always goes from one build to its opposite.
     * @return HG38 for HG19 and HG19 for HG38
     */
    public GenomeBuild opposite() {
        return this == HG19 ? HG38 : HG19;
    }

    /**
     * Finds build by its UCSC (hg19, hg38) or GRC (GRCh37, GRCh38) name, case-insensitive.
     * @param name name of the build
     * @return genome build
     * @throws WrongVariantFormatException if name is not one of the supported builds
     */
    public static GenomeBuild fromName(String name) {
        if (name != null) {
            String trimmed = name.trim();
            for (GenomeBuild build : values()) {
                if (build.ucscName.equalsIgnoreCase(trimmed)
                        || build.grcName.equalsIgnoreCase(trimmed)
                        || build.name().equalsIgnoreCase(trimmed)) {
                    return build;
                }
            }
        }
        throw new WrongVariantFormatException(String.format(WrongVariantFormatException.UNKNOWN_BUILD, name));
    }

    @Override
    public String toString() {
        return ucscName;
    }
}
