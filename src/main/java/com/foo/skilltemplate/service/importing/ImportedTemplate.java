package com.foo.skilltemplate.service.importing;

import com.foo.skilltemplate.model.Sheet;

public record ImportedTemplate(String templateName, String fileName, Sheet sheet) {}
