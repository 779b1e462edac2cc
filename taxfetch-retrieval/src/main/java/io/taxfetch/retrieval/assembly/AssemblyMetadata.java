package io.taxfetch.retrieval.assembly;


/*
 * Copyright (c) taxfetch
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// Classification and naming facts for one assembly, read once from its summary.
///
/// @param uid the assembly identifier
/// @param accession versioned assembly accession, e.g. `GCA_000005845.2`
/// @param assemblyName the submitter's assembly name, may be empty
/// @param organism the binomial species name
/// @param genus first word of the organism
/// @param species remainder of the organism after the genus, may be empty
/// @param strain infraspecific name, may be empty
/// @param speciesTaxid taxon identifier of the species, may be empty
/// @param genbankFtpPath directory of the GenBank files, may be empty
/// @param refseqFtpPath directory of the RefSeq files, may be empty
public record AssemblyMetadata(
    String uid,
    String accession,
    String assemblyName,
    String organism,
    String genus,
    String species,
    String strain,
    String speciesTaxid,
    String genbankFtpPath,
    String refseqFtpPath
) {

    public AssemblyMetadata {
        if (accession == null || accession.isBlank()) {
            throw new IllegalArgumentException("accession is required");
        }
        if (organism == null || organism.isBlank()) {
            throw new IllegalArgumentException("organism is required");
        }
        assemblyName = nullToEmpty(assemblyName);
        genus = nullToEmpty(genus);
        species = nullToEmpty(species);
        strain = nullToEmpty(strain);
        speciesTaxid = nullToEmpty(speciesTaxid);
        genbankFtpPath = nullToEmpty(genbankFtpPath);
        refseqFtpPath = nullToEmpty(refseqFtpPath);
    }

    /// Split an organism name into genus and species at the first space.
    /// @param uid assembly identifier
    /// @param accession assembly accession
    /// @param assemblyName assembly name
    /// @param organism binomial name
    /// @param strain infraspecific name
    /// @param speciesTaxid species taxon
    /// @param genbankFtpPath GenBank directory
    /// @param refseqFtpPath RefSeq directory
    /// @return the metadata
    public static AssemblyMetadata of(String uid, String accession, String assemblyName, String organism,
                                      String strain, String speciesTaxid, String genbankFtpPath,
                                      String refseqFtpPath) {
        String trimmed = organism == null ? "" : organism.trim();
        int space = trimmed.indexOf(' ');
        String genus = space < 0 ? trimmed : trimmed.substring(0, space);
        String species = space < 0 ? "" : trimmed.substring(space + 1);
        return new AssemblyMetadata(uid, accession, assemblyName, trimmed, genus, species,
            strain == null ? "" : strain.trim(), speciesTaxid, genbankFtpPath, refseqFtpPath);
    }

    /// @return the line for the classes file, `accession<TAB>organism`
    public String classLine() {
        return accession + "\t" + organism;
    }

    /// @return the line for the labels file, `accession<TAB>G. species strain`
    public String labelLine() {
        return accession + "\t" + genus.charAt(0) + ". " + species + " " + strain;
    }

    /// @return genus initial, species and strain, for log messages
    public String displayName() {
        return (genus.charAt(0) + ". " + species + " " + strain).trim();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
