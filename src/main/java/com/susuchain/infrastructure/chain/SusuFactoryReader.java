package com.susuchain.infrastructure.chain;

import java.util.List;

public interface SusuFactoryReader {

    List<String> getRecentGroups(int count);

    List<String> getAllGroups();
}
