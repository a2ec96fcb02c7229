package io.b2mash.crm.crmcore.company;

/** Postal address stored as a JSON document; every part is optional. */
public record Address(
    String street, String city, String state, String postalCode, String country) {}
