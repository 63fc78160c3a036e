package dev.leaddispatch.exception;

public class RecordNotFoundException extends DispatchException {

    public RecordNotFoundException(String message) {
        super(message);
    }

    public static RecordNotFoundException lead(Long id) {
        return new RecordNotFoundException("Lead ID " + id + " not found");
    }

    public static RecordNotFoundException worker(Long id) {
        return new RecordNotFoundException("Worker ID " + id + " not found");
    }

    public static RecordNotFoundException job(Long id) {
        return new RecordNotFoundException("Job ID " + id + " not found");
    }
}
