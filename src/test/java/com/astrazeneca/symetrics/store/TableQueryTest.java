package com.astrazeneca.symetrics.store;

import org.testng.annotations.Test;

import java.util.Arrays;

import static org.testng.Assert.assertEquals;

public class TableQueryTest {

    @Test
    public void testSqlQuotesIdentifiersAndBindsValues() {
        TableQuery query = TableQuery.from("SILVA")
                .select("#chrom", "CHR")
                .select("#GERP++", "GERP")
                .where("#chrom", "7")
                .where("pos", 91763673);
        assertEquals(query.toSql(),
                "SELECT \"#chrom\" AS \"CHR\", \"#GERP++\" AS \"GERP\" FROM \"SILVA\" WHERE \"#chrom\" = ? AND \"pos\" = ?");
        assertEquals(query.getParameters(), Arrays.<Object>asList("7", 91763673));
    }

    @Test
    public void testQuoteEscapesQuotes() {
        assertEquals(TableQuery.quote("a\"b"), "\"a\"\"b\"");
    }

    @Test
    public void testNoPredicates() {
        assertEquals(TableQuery.from("T").select("a", "A").toSql(), "SELECT \"a\" AS \"A\" FROM \"T\"");
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testNoColumns() {
        TableQuery.from("T").where("a", 1).toSql();
    }
}
