package com.crowd.config.serializer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.io.WKTWriter;

import java.io.IOException;

/**
 * Custom Jackson serializer for JTS Geometry objects such as cell bounds
 */
public class GeometrySerializer extends JsonSerializer<Geometry> {
    
    private final WKTWriter wktWriter;
    
    public GeometrySerializer(WKTWriter wktWriter) {
        this.wktWriter = wktWriter;
    }
    
    @Override
    public void serialize(Geometry geometry, JsonGenerator gen, SerializerProvider serializers) 
            throws IOException {
        if (geometry == null) {
            gen.writeNull();
            return;
        }
        
        gen.writeStartObject();
        gen.writeStringField("type", geometry.getGeometryType());
        if (geometry instanceof Point) {
            // Points are easier to consume as lat/lng
            Point point = (Point) geometry;
            gen.writeNumberField("lat", point.getY());
            gen.writeNumberField("lng", point.getX());
        } else {
            gen.writeStringField("wkt", wktWriter.write(geometry));
        }
        gen.writeEndObject();
    }
}
