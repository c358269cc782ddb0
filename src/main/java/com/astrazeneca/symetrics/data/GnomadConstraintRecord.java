package com.astrazeneca.symetrics.data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One transcript row of the gnomAD gene constraint table.
 */
public class GnomadConstraintRecord {
    public final String gene;
    public final String transcript;
    public final double synZ;
    public final double misZ;
    public final double lofZ;
    public final double pLI;

    public GnomadConstraintRecord(String gene, String transcript, double synZ, double misZ, double lofZ, double pLI) {
        this.gene = gene;
        this.transcript = transcript;
        this.synZ = synZ;
        this.misZ = misZ;
        this.lofZ = lofZ;
        this.pLI = pLI;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("gene", gene);
        map.put("transcript", transcript);
        map.put("syn_z", synZ);
        map.put("mis_z", misZ);
        map.put("lof_z", lofZ);
        map.put("pLI", pLI);
        return map;
    }

    @Override
    public String toString() {
        return "GnomadConstraintRecord [gene=" + gene + ", transcript=" + transcript + ", syn_z=" + synZ
                + ", mis_z=" + misZ + ", lof_z=" + lofZ + ", pLI=" + pLI + "]";
    }
}
