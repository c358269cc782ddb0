package com.astrazeneca.symetrics.data;

import com.astrazeneca.symetrics.exception.WrongVariantFormatException;
import htsjdk.samtools.util.Locatable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;

import static com.astrazeneca.symetrics.data.Patterns.ALLELE;
import static com.astrazeneca.symetrics.data.Patterns.CHR_PREFIX;
import static com.astrazeneca.symetrics.data.Patterns.VARIANT_NOTATION;

/**
 * Identity of a single substitution in one genome build. The score tables are keyed by exact equality on
 * chromosome, position, reference and alternative alleles.
 */
public class VariantKey implements Locatable {
    /**
     * Chromosome name without "chr" prefix (tables store 1..22, X, Y)
     */
    public final String chr;

    /**
     * 1-based position in {@link #genome}
     */
    public final int position;

    /**
     * Reference allele
     */
    public final String ref;

    /**
     * Alternative allele
     */
    public final String alt;

    /**
     * Build of the position
     */
    public final GenomeBuild genome;

    public VariantKey(String chr, int position, String ref, String alt, GenomeBuild genome) {
        if (chr == null || chr.trim().isEmpty()) {
            throw new WrongVariantFormatException(String.format(WrongVariantFormatException.EMPTY_CHROMOSOME, chr));
        }
        if (position < 1) {
            throw new WrongVariantFormatException(String.format(WrongVariantFormatException.WRONG_POSITION, position));
        }
        if (genome == null) {
            throw new WrongVariantFormatException(String.format(WrongVariantFormatException.UNKNOWN_BUILD, "null"));
        }
        this.chr = normalizeChromosome(chr);
        this.position = position;
        this.ref = normalizeAllele(ref);
        this.alt = normalizeAllele(alt);
        this.genome = genome;
    }

    /**
     * Parses variant from notation chr-pos-ref-alt (also chr:pos:ref:alt and chr:pos:ref>alt).
     * @param notation variant string, e.g. 7-91763673-C-A
     * @param genome build of the position
     * @return parsed variant
     */
    public static VariantKey parse(String notation, GenomeBuild genome) {
        if (notation == null) {
            throw new WrongVariantFormatException(String.format(WrongVariantFormatException.WRONG_NOTATION, "null"));
        }
        Matcher matcher = VARIANT_NOTATION.matcher(notation.trim());
        if (!matcher.find()) {
            throw new WrongVariantFormatException(String.format(WrongVariantFormatException.WRONG_NOTATION, notation));
        }
        int position;
        try {
            position = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            throw new WrongVariantFormatException(String.format(WrongVariantFormatException.WRONG_NOTATION, notation));
        }
        return new VariantKey(matcher.group(1), position, matcher.group(3), matcher.group(4), genome);
    }

    static String normalizeChromosome(String chr) {
        return CHR_PREFIX.matcher(chr.trim()).replaceFirst("");
    }

    static String normalizeAllele(String allele) {
        String normalized = allele == null ? "" : allele.trim().toUpperCase();
        if (!ALLELE.matcher(normalized).matches()) {
            throw new WrongVariantFormatException(String.format(WrongVariantFormatException.WRONG_ALLELE, allele));
        }
        return normalized;
    }

    @Override
    public String getContig() {
        return chr;
    }

    @Override
    public int getStart() {
        return position;
    }

    @Override
    public int getEnd() {
        return position + ref.length() - 1;
    }

    /**
     * @return ordered map for printing: CHR, POS, REF, ALT, GENOME
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("CHR", chr);
        map.put("POS", position);
        map.put("REF", ref);
        map.put("ALT", alt);
        map.put("GENOME", genome.getUcscName());
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VariantKey that = (VariantKey) o;
        return position == that.position &&
                Objects.equals(chr, that.chr) &&
                Objects.equals(ref, that.ref) &&
                Objects.equals(alt, that.alt) &&
                genome == that.genome;
    }

    @Override
    public int hashCode() {
        return Objects.hash(chr, position, ref, alt, genome);
    }

    @Override
    public String toString() {
        return chr + "-" + position + "-" + ref + "-" + alt + " (" + genome + ")";
    }
}
