package io.b2mash.crm.crmcore.company;

/**
 * @param name case-insensitive substring of the company name, or {@code null} for no constraint
 */
public record CompanyFilter(String name) {

  public static CompanyFilter none() {
    return new CompanyFilter(null);
  }
}
