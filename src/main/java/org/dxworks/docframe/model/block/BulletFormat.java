package org.dxworks.docframe.model.block;

public interface BulletFormat {
}
