package com.nana.contacts.service;

/**
 * ImportUpload - A file handed to the preview step.
 */
public final class ImportUpload {

    private final String fileName;
    private final String contentType;
    private final byte[] bytes;

    /**
     * @param fileName    original file name, may be null
     * @param contentType declared MIME type, may be null
     * @param bytes       file content; a null array means no file was given
     */
    public ImportUpload(String fileName, String contentType, byte[] bytes) {
        this.fileName    = fileName;
        this.contentType = contentType;
        this.bytes       = bytes;
    }

    public String getFileName()     { return fileName; }
    public String getContentType()  { return contentType; }
    public byte[] getBytes()        { return bytes; }

    public long getSize() {
        return bytes == null ? 0 : bytes.length;
    }

    @Override
    public String toString() {
        return "ImportUpload{fileName='" + fileName + "', contentType='" + contentType
               + "', size=" + getSize() + "}";
    }
}
