package com.foo.sheetsync.sheet.xlsx;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.poi.openxml4j.util.ZipSecureFile;
import org.apache.poi.util.IOUtils;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * Secure loading of the workbook that backs a spreadsheet document.
 * Protects against disguised files and Zip Bombs before POI parses the package.
 */
final class SecureWorkbookLoader {

    // Maximum size for byte array allocation (200 MB)
    private static final int MAX_BYTE_ARRAY_SIZE = 200_000_000;

    // Entries that inflate more than 100x are treated as zip bombs
    private static final double MIN_INFLATE_RATIO = 0.01;

    // XLSX magic bytes (ZIP format: PK)
    private static final byte[] XLSX_MAGIC = {0x50, 0x4B, 0x03, 0x04};

    static {
        IOUtils.setByteArrayMaxOverride(MAX_BYTE_ARRAY_SIZE);
        ZipSecureFile.setMinInflateRatio(MIN_INFLATE_RATIO);
    }

    private SecureWorkbookLoader() {
        // Utility class
    }

    /**
     * Loads the whole workbook into memory so the file can be rewritten when the session closes.
     *
     * @throws IOException if the file cannot be read or is not a valid workbook
     * @throws SecurityException if the file content does not match the XLSX format
     */
    static XSSFWorkbook load(Path path) throws IOException {
        validateFileContent(path);

        try (InputStream in = Files.newInputStream(path)) {
            return new XSSFWorkbook(in);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Failed to open XLSX file securely: " + e.getMessage(), e);
        }
    }

    /**
     * Validates that a file's content matches its extension.
     *
     * @throws SecurityException if the file content doesn't match expected format
     */
    static void validateFileContent(Path path) throws IOException {
        String fileName = path.getFileName().toString().toLowerCase();
        if (!fileName.endsWith(".xlsx")) {
            throw new SecurityException("Only .xlsx documents are supported.");
        }

        byte[] header = readFileHeader(path, XLSX_MAGIC.length);
        if (!matchesMagicBytes(header, XLSX_MAGIC)) {
            throw new SecurityException(
                "File content does not match XLSX format. " +
                "The file may be corrupted or disguised.");
        }
    }

    private static byte[] readFileHeader(Path path, int length) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            byte[] header = new byte[length];
            int read = is.readNBytes(header, 0, length);
            if (read < length) {
                throw new SecurityException("File is too small to be a valid Excel file");
            }
            return header;
        }
    }

    private static boolean matchesMagicBytes(byte[] header, byte[] magic) {
        if (header.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (header[i] != magic[i]) {
                return false;
            }
        }
        return true;
    }
}
