package io.twin4j.internal.mongo;

import io.twin4j.core.UploadStatus;
import org.springframework.data.annotation.Id;

import java.time.Instant;

/**
 * Row of a stream collection. There is no {@code @Document} mapping: every stream has its own
 * collection, named after the stream, and the collection is passed explicitly on each call.
 */
public class RecordDocument {

    @Id
    private String id;

    private Instant date;
    private String contentType;
    private String blobRef;

    // asset streams only
    private String description;
    private String source;
    private String ownerId;
    private String filename;
    private Boolean isPublic;
    private String publicUrl;
    private UploadStatus uploadStatus;
    private String uploadError;
    private String uploadJobId;

    public RecordDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getDate() {
        return date;
    }

    public void setDate(Instant date) {
        this.date = date;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    public String getBlobRef() {
        return blobRef;
    }

    public void setBlobRef(String blobRef) {
        this.blobRef = blobRef;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public Boolean getIsPublic() {
        return isPublic;
    }

    public void setIsPublic(Boolean isPublic) {
        this.isPublic = isPublic;
    }

    public String getPublicUrl() {
        return publicUrl;
    }

    public void setPublicUrl(String publicUrl) {
        this.publicUrl = publicUrl;
    }

    public UploadStatus getUploadStatus() {
        return uploadStatus;
    }

    public void setUploadStatus(UploadStatus uploadStatus) {
        this.uploadStatus = uploadStatus;
    }

    public String getUploadError() {
        return uploadError;
    }

    public void setUploadError(String uploadError) {
        this.uploadError = uploadError;
    }

    public String getUploadJobId() {
        return uploadJobId;
    }

    public void setUploadJobId(String uploadJobId) {
        this.uploadJobId = uploadJobId;
    }
}
