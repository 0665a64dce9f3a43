package com.example.personioexport.infrastructure.pdf;

import com.example.personioexport.infrastructure.exception.DocumentPayloadException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Infrastructure service that checks downloaded PDF payloads with PDFBox before they are kept.
 * Personio answers some failed downloads with an HTML or JSON error body and a success status;
 * those payloads are caught here.
 */
@Service
public class PdfDocumentInspector {

    private static final Logger log = LoggerFactory.getLogger(PdfDocumentInspector.class);

	/**
	 * Parses the payload and reports its page count.
	 *
	 * @param payload  downloaded bytes
	 * @param filename name used for log messages
	 * @return number of pages in the document, 0 for password protected documents
	 * @throws DocumentPayloadException when PDFBox cannot read the bytes as a PDF
	 */
    public int inspect(byte[] payload, String filename) {
        try (PDDocument document = Loader.loadPDF(payload)) {
            int pages = document.getNumberOfPages();
            log.debug("Verified PDF {} ({} pages, title: {}, encrypted: {})",
                    filename, pages, title(document.getDocumentInformation()), document.isEncrypted());
            return pages;
        } catch (InvalidPasswordException ex) {
            log.debug("PDF {} is password protected, keeping it unverified", filename);
            return 0;
        } catch (IOException ex) {
            throw new DocumentPayloadException("Payload of " + filename + " is not a readable PDF", ex);
        }
    }

    private String title(PDDocumentInformation info) {
        return info == null || info.getTitle() == null ? "" : info.getTitle();
    }
}
