package com.williamcallahan.photo_print_preview.service.print;

import org.springframework.stereotype.Component;

import javax.print.PrintService;
import javax.print.PrintServiceLookup;

/**
 * Thin seam over {@link PrintServiceLookup} so printer discovery can be replaced in tests
 */
@Component
public class PrinterLookup {

    public PrintService[] availablePrinters() {
        PrintService[] services = PrintServiceLookup.lookupPrintServices(null, null);
        return services == null ? new PrintService[0] : services;
    }

    public PrintService defaultPrinter() {
        return PrintServiceLookup.lookupDefaultPrintService();
    }
}
