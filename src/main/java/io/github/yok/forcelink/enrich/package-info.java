/**
 * Web scraping collaborators of the enrichment pipeline.
 *
 * <p>
 * {@link io.github.yok.forcelink.enrich.WebCompanyScraper} finds a company's site and extracts a
 * {@link io.github.yok.forcelink.enrich.CompanyProfile};
 * {@link io.github.yok.forcelink.enrich.CandidateFieldMapper} turns the profile into proposed
 * field values for one object type.
 * </p>
 */
package io.github.yok.forcelink.enrich;
