package com.williamcallahan.statuteindex.service.markup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.statuteindex.domain.legislation.ProvisionExtraction;
import com.williamcallahan.statuteindex.domain.legislation.ProvisionRecord;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.Test;

/**
 * Verifies provision extraction from legislative markup bodies.
 */
class ProvisionTreeWalkerTest {

    private final ProvisionTreeWalker walker = new ProvisionTreeWalker();

    private static Element body(String innerMarkup) {
        Document document = Jsoup.parse("<body>" + innerMarkup + "</body>", "", Parser.xmlParser());
        return document.selectFirst("body");
    }

    @Test
    void walk_prefersSubsectionIdentifierWhenSectionHasNoNum() {
        ProvisionExtraction extraction = walker.walk(body(
                "<section eId=\"section-1-2\"><content><p>Second limb.</p></content></section>"));

        assertEquals(1, extraction.provisions().size());
        assertEquals("s1(2)", extraction.provisions().get(0).provisionRef());
        assertEquals("Second limb.", extraction.provisions().get(0).content());
    }

    @Test
    void walk_sectionWithoutNumIsLabelledByItsReference() {
        ProvisionExtraction extraction = walker.walk(body(
                "<section eId=\"section-3\"><heading>Terms</heading><content><p>Defined terms.</p></content></section>"));

        ProvisionRecord section = extraction.provisions().get(0);
        assertEquals("s3", section.provisionRef());
        assertEquals("s3", section.section());
    }

    @Test
    void walk_blankSubsectionContributesNoRecord() {
        ProvisionExtraction extraction = walker.walk(body(
                "<hcontainer name=\"crossheading\">"
                        + "<section eId=\"section-4\"><num>4</num><heading>Duties</heading>"
                        + "<subsection eId=\"section-4-1\"><num>(1)</num><content><p>A duty applies.</p></content></subsection>"
                        + "<subsection eId=\"section-4-2\"><num>(2)</num><content><p>   </p></content></subsection>"
                        + "</section></hcontainer>"));

        List<ProvisionRecord> provisions = extraction.provisions();
        assertEquals(1, provisions.size());
        ProvisionRecord only = provisions.get(0);
        assertEquals("s4(1)", only.provisionRef());
        assertEquals("4(1)", only.section());
        assertEquals("Duties", only.title());
    }

    @Test
    void walk_collectsIntroParagraphsAndWrapUpInDocumentOrder() {
        ProvisionExtraction extraction = walker.walk(body(
                "<section eId=\"section-7\"><num>7.</num><heading>Conditions</heading>"
                        + "<intro><p>The conditions are</p></intro>"
                        + "<paragraph><num>(a)</num><content><p>first,</p></content></paragraph>"
                        + "<paragraph><num>(b)</num><content><p>second,</p></content></paragraph>"
                        + "<wrapUp><p>and no others.</p></wrapUp></section>"));

        ProvisionRecord section = extraction.provisions().get(0);
        assertEquals("s7", section.provisionRef());
        assertEquals("7", section.section());
        assertEquals("The conditions are (a) first, (b) second, and no others.", section.content());
    }

    @Test
    void walk_descendsPartsAndChaptersInOrder() {
        ProvisionExtraction extraction = walker.walk(body(
                "<part eId=\"part-1\"><num>PART 1</num><heading>General</heading>"
                        + "<chapter eId=\"part-1-chapter-1\"><num>CHAPTER 1</num>"
                        + "<section eId=\"section-1\"><num>1</num><content><p>One.</p></content></section>"
                        + "<section eId=\"section-2\"><num>2</num><content><p>Two.</p></content></section>"
                        + "</chapter></part>"
                        + "<part eId=\"part-2\"><section eId=\"section-3\"><num>3</num><content><p>Three.</p></content></section></part>"));

        List<String> references = extraction.provisions().stream().map(ProvisionRecord::provisionRef).toList();
        assertEquals(List.of("s1", "s2", "s3"), references);
    }

    @Test
    void walk_keepsLetterSuffixesInReferences() {
        ProvisionExtraction extraction = walker.walk(body(
                "<section eId=\"section-12A\"><num>12A</num><heading>Inserted</heading>"
                        + "<subsection eId=\"section-12A-1\"><num>(1)</num><content><p>Inserted text.</p></content></subsection>"
                        + "</section>"));

        ProvisionRecord subsection = extraction.provisions().get(0);
        assertEquals("s12A(1)", subsection.provisionRef());
        assertEquals("12A(1)", subsection.section());
    }

    @Test
    void walk_identifierWinsOverDisagreeingNum() {
        ProvisionExtraction extraction = walker.walk(body(
                "<section eId=\"section-1\"><num>1A</num><content><p>Text.</p></content></section>"));

        ProvisionRecord section = extraction.provisions().get(0);
        assertEquals("s1", section.provisionRef());
        assertEquals("1A", section.section());
    }

    @Test
    void walk_derivesReferenceFromNumWhenIdentifierMissing() {
        ProvisionExtraction extraction = walker.walk(body(
                "<section><num>9.</num><subsection><num>(3)</num><content><p>Sub text.</p></content></subsection></section>"));

        ProvisionRecord subsection = extraction.provisions().get(0);
        assertEquals("s9(3)", subsection.provisionRef());
        assertEquals("9(3)", subsection.section());
        assertNull(subsection.title());
    }

    @Test
    void walk_rekeysRepeatedReferencesAndReportsConflicts() {
        ProvisionExtraction extraction = walker.walk(body(
                "<section eId=\"section-5\"><num>5</num><content><p>Original.</p></content></section>"
                        + "<section eId=\"section-5\"><num>5</num><content><p>Substituted.</p></content></section>"
                        + "<section eId=\"section-5\"><num>5</num><content><p>Again.</p></content></section>"));

        List<String> references = extraction.provisions().stream().map(ProvisionRecord::provisionRef).toList();
        assertEquals(List.of("s5", "s5~2", "s5~3"), references);
        assertTrue(extraction.hasConflicts());
        assertEquals(2, extraction.conflicts().size());
        assertEquals("s5", extraction.conflicts().get(0).derivedRef());
        assertEquals("s5~2", extraction.conflicts().get(0).assignedRef());
    }

    @Test
    void walk_neverEmitsBlankBodiesAndReferencesAreUnique() {
        ProvisionExtraction extraction = walker.walk(body(
                "<section eId=\"section-1\"><num>1</num><heading>Only heading</heading></section>"
                        + "<section eId=\"section-2\"><num>2</num>"
                        + "<subsection eId=\"section-2-1\"><num>(1)</num><content><p>Body.</p></content></subsection>"
                        + "<subsection eId=\"section-2-1\"><num>(1)</num><content><p>Body again.</p></content></subsection>"
                        + "</section>"
                        + "<hcontainer eId=\"schedule-1\"><content><p>Schedule text.</p></content></hcontainer>"));

        Set<String> seen = new HashSet<>();
        for (ProvisionRecord provision : extraction.provisions()) {
            assertFalse(provision.content().isBlank());
            assertTrue(seen.add(provision.provisionRef()), "Duplicate reference " + provision.provisionRef());
        }
        assertTrue(seen.contains("schedule-1"));
    }

    @Test
    void walk_nullBodyYieldsNothing() {
        assertTrue(walker.walk(null).provisions().isEmpty());
    }

    @Test
    void deriveReference_fallsBackToUnknownKind() {
        assertEquals("section-unknown", ProvisionTreeWalker.deriveReference("", MarkupNodeKind.SECTION, "", null));
        assertEquals("hc4", ProvisionTreeWalker.deriveReference(null, MarkupNodeKind.HCONTAINER, "4.", null));
    }
}
