package com.example.documents.support;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;

/**
 * Builds real PDF fixtures with PDFBox.
 */
public final class TestPdfs {

    private TestPdfs() {
    }

    /**
     * Creates a one-page PDF showing the given text.
     *
     * @param text text rendered on the page
     * @return PDF bytes
     * @throws IOException when PDFBox fails to serialize the document
     */
    public static byte[] createPdf(String text) throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {

            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);

            try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                contentStream.beginText();
                contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD), 18);
                contentStream.newLineAtOffset(72, 700);
                contentStream.showText(text);
                contentStream.endText();
            }

            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }

    /**
     * Creates a PDF padded with trailing whitespace to exactly {@code size} bytes.
     *
     * @param size total length of the returned content
     * @return PDF bytes of the requested length
     * @throws IOException when PDFBox fails to serialize the document
     */
    public static byte[] createPdfOfSize(int size) throws IOException {
        byte[] pdf = createPdf("Padded fixture");
        if (pdf.length > size) {
            throw new IllegalArgumentException("Requested size " + size + " is smaller than the PDF itself");
        }
        byte[] padded = Arrays.copyOf(pdf, size);
        Arrays.fill(padded, pdf.length, size, (byte) '\n');
        return padded;
    }
}
