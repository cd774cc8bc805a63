package org.processverify.engine.similarity;

import org.processverify.engine.similarity.models.JaccardReport;
import org.processverify.engine.similarity.models.SsdtReport;
import org.processverify.engine.source.DocumentHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

public class SimilarityReportHelper {
    private static final Logger log = LoggerFactory.getLogger(SimilarityReportHelper.class);

    public static void saveJaccardReport(JaccardReport report, Path outputFile) throws IOException {
        DocumentHelper.writeDocument(outputFile, report);
        log.info("Jaccard similarity saved to '{}'", outputFile);
    }

    public static void saveSsdtReport(SsdtReport report, Path outputFile) throws IOException {
        DocumentHelper.writeDocument(outputFile, report);
        log.info("SSDT similarity saved to '{}'", outputFile);
    }
}
