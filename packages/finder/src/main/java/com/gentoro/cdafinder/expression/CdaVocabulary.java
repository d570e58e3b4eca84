package com.gentoro.cdafinder.expression;

import java.util.Set;

/** Element names known to live in the CDA namespace, used to qualify unprefixed steps. */
public final class CdaVocabulary {

  /** Entry-level acts that may appear at any depth. A leading step naming one searches anywhere. */
  public static final Set<String> REPEATING_ACTS =
      Set.of(
          "observation", "act", "organizer", "substanceAdministration", "encounter", "procedure");

  private static final Set<String> ELEMENTS =
      Set.of(
          "ClinicalDocument",
          "realmCode",
          "typeId",
          "templateId",
          "id",
          "code",
          "title",
          "effectiveTime",
          "confidentialityCode",
          "languageCode",
          "setId",
          "versionNumber",
          "recordTarget",
          "patientRole",
          "patient",
          "name",
          "prefix",
          "given",
          "family",
          "suffix",
          "addr",
          "streetAddressLine",
          "city",
          "state",
          "postalCode",
          "county",
          "country",
          "telecom",
          "administrativeGenderCode",
          "birthTime",
          "maritalStatusCode",
          "raceCode",
          "ethnicGroupCode",
          "guardian",
          "birthplace",
          "languageCommunication",
          "providerOrganization",
          "author",
          "time",
          "assignedAuthor",
          "assignedPerson",
          "representedOrganization",
          "custodian",
          "assignedCustodian",
          "representedCustodianOrganization",
          "documentationOf",
          "serviceEvent",
          "performer",
          "assignedEntity",
          "componentOf",
          "encompassingEncounter",
          "location",
          "healthCareFacility",
          "serviceProviderOrganization",
          "responsibleParty",
          "component",
          "structuredBody",
          "section",
          "text",
          "entry",
          "entryRelationship",
          "observation",
          "organizer",
          "act",
          "encounter",
          "procedure",
          "substanceAdministration",
          "supply",
          "statusCode",
          "value",
          "low",
          "high",
          "center",
          "width",
          "methodCode",
          "interpretationCode",
          "targetSiteCode",
          "routeCode",
          "doseQuantity",
          "rateQuantity",
          "quantity",
          "repeatNumber",
          "priorityCode",
          "translation",
          "originalText",
          "reference",
          "referenceRange",
          "observationRange",
          "consumable",
          "manufacturedProduct",
          "manufacturedMaterial",
          "participant",
          "participantRole",
          "playingEntity",
          "specimen",
          "specimenRole",
          "specimenPlayingEntity");

  private CdaVocabulary() {}

  public static boolean isCdaElement(String localName) {
    return ELEMENTS.contains(localName);
  }

  public static boolean isRepeatingAct(String localName) {
    return REPEATING_ACTS.contains(localName);
  }
}
