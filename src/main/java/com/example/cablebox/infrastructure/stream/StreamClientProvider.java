package com.example.cablebox.infrastructure.stream;

public interface StreamClientProvider {

    StreamUrlResolver forUser(Long userId);
}
