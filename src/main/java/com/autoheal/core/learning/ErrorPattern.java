package com.autoheal.core.learning;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/** How often one error type has been seen, with its distinct messages. */
public class ErrorPattern {

    private int count;

    @JsonProperty("first_seen")
    private LocalDateTime firstSeen;

    @JsonProperty("last_seen")
    private LocalDateTime lastSeen;

    private List<String> messages = new ArrayList<>();

    public ErrorPattern() {
    }

    ErrorPattern(LocalDateTime now) {
        this.firstSeen = now;
        this.lastSeen  = now;
    }

    void record(String message, LocalDateTime now) {
        count++;
        lastSeen = now;
        if (message != null && !message.isEmpty() && !messages.contains(message)) {
            messages.add(message);
        }
    }

    public int getCount()                { return count; }
    public void setCount(int count)      { this.count = count; }
    public LocalDateTime getFirstSeen()  { return firstSeen; }
    public void setFirstSeen(LocalDateTime v) { this.firstSeen = v; }
    public LocalDateTime getLastSeen()   { return lastSeen; }
    public void setLastSeen(LocalDateTime v)  { this.lastSeen = v; }
    public List<String> getMessages()    { return messages; }
    public void setMessages(List<String> v)   { this.messages = v != null ? v : new ArrayList<>(); }
}
